package com.ryuqq.eventflow.core.statemachine;

/**
 * Catch-up 스트림 리스너의 생명주기 상태.
 *
 * <pre>
 * NOT_STARTED ─► READING_HISTORY ─► LIVE ─► STOPPED
 *      │                │                     ▲
 *      └────────────────┴─────────────────────┘
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ListenerState {

    NOT_STARTED,

    /**
     * 체크포인트 이후의 과거 이벤트를 재생 중.
     */
    READING_HISTORY,

    /**
     * 새로 추가되는 이벤트를 실시간 수신 중.
     */
    LIVE,

    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
