package com.ryuqq.eventflow.core.time;

/**
 * 단조 증가 논리 시계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimeSource {

    TimePosition now();

    /**
     * 생성 시점을 {@link TimePosition#START}로 하는 새 시스템 시계.
     */
    static TimeSource system() {
        return new MonotonicTimeSource();
    }
}
