package com.ryuqq.eventflow.core.statemachine;

/**
 * 추적 중인 Command의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING_ACK
 *    │
 *    ├─► PENDING_RESPONSE (첫 번째 Ack)
 *    │        │
 *    │        └─► COMPLETE (응답 / 완료 타임아웃 / oversubscription)
 *    │
 *    └─► COMPLETE (응답 / Ack 타임아웃 / 취소)
 *
 * 금지된 전이:
 * - COMPLETE → * ❌
 * - PENDING_RESPONSE → PENDING_ACK ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CommandState {

    /**
     * 핸들러의 Ack 대기 중.
     */
    PENDING_ACK,

    /**
     * Ack 수신, 응답 대기 중.
     */
    PENDING_RESPONSE,

    /**
     * 결과 확정 (성공, 실패, 취소 모두 포함).
     */
    COMPLETE;

    public boolean isTerminal() {
        return this == COMPLETE;
    }
}
