package com.ryuqq.eventflow.core.time;

/**
 * {@link System#nanoTime()} 기반 단조 시계.
 *
 * <p>벽시계 조정(NTP 등)의 영향을 받지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MonotonicTimeSource implements TimeSource {

    private final long originNanos;

    public MonotonicTimeSource() {
        this.originNanos = System.nanoTime();
    }

    @Override
    public TimePosition now() {
        return TimePosition.ofMillis((System.nanoTime() - originNanos) / 1_000_000L);
    }
}
