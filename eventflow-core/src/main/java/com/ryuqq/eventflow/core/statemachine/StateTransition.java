package com.ryuqq.eventflow.core.statemachine;

/**
 * 상태 전이 검증.
 *
 * <p>허용되지 않은 전이는 {@link IllegalStateException}으로 거부합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CommandState: PENDING_ACK → PENDING_RESPONSE, PENDING_ACK → COMPLETE, PENDING_RESPONSE → COMPLETE</li>
 *   <li>ListenerState: NOT_STARTED → READING_HISTORY → LIVE, 종료 전 모든 상태 → STOPPED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 종료 상태에서는 어떤 상태로도 전이 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 전이가 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(CommandState from, CommandState to) {
        requireStates(from, to);
        return switch (from) {
            case PENDING_ACK -> to == CommandState.PENDING_RESPONSE || to == CommandState.COMPLETE;
            case PENDING_RESPONSE -> to == CommandState.COMPLETE;
            case COMPLETE -> false;
        };
    }

    /**
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CommandState from, CommandState to) {
        if (!isAllowed(from, to)) {
            throw invalid(from, to, from.isTerminal());
        }
    }

    public static boolean isAllowed(ListenerState from, ListenerState to) {
        requireStates(from, to);
        return switch (from) {
            case NOT_STARTED -> to == ListenerState.READING_HISTORY || to == ListenerState.STOPPED;
            case READING_HISTORY -> to == ListenerState.LIVE || to == ListenerState.STOPPED;
            case LIVE -> to == ListenerState.STOPPED;
            case STOPPED -> false;
        };
    }

    /**
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ListenerState from, ListenerState to) {
        if (!isAllowed(from, to)) {
            throw invalid(from, to, from.isTerminal());
        }
    }

    private static void requireStates(Object from, Object to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
    }

    private static IllegalStateException invalid(Object from, Object to, boolean terminal) {
        if (terminal) {
            return new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        return new IllegalStateException(String.format("Invalid state transition: %s → %s", from, to));
    }
}
