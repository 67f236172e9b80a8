package com.ryuqq.eventflow.core.model;

/**
 * append 결과.
 *
 * @param nextExpectedVersion 다음 append에 사용할 expectedVersion (= 마지막 이벤트 번호)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WriteResult(long nextExpectedVersion) {
}
