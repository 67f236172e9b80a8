package com.ryuqq.eventflow.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.eventflow.core.statemachine.CommandState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== CommandState 정상 전이 ==========

    @Test
    void validate_PendingAckToPendingResponse_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(PENDING_ACK, PENDING_RESPONSE));
    }

    @Test
    void validate_PendingAckToComplete_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(PENDING_ACK, COMPLETE));
    }

    @Test
    void validate_PendingResponseToComplete_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> StateTransition.validate(PENDING_RESPONSE, COMPLETE));
    }

    // ========== CommandState 금지 전이 ==========

    @Test
    void validate_CompleteToPendingAck_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(COMPLETE, PENDING_ACK)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_PendingResponseToPendingAck_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PENDING_RESPONSE, PENDING_ACK)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void isAllowed_SecondAck_ReturnsFalse() {
        // When & Then
        assertFalse(StateTransition.isAllowed(PENDING_RESPONSE, PENDING_RESPONSE));
    }

    @Test
    void validate_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, COMPLETE));
    }

    // ========== ListenerState ==========

    @Test
    void validate_ListenerNormalFlow_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> {
            StateTransition.validate(ListenerState.NOT_STARTED, ListenerState.READING_HISTORY);
            StateTransition.validate(ListenerState.READING_HISTORY, ListenerState.LIVE);
            StateTransition.validate(ListenerState.LIVE, ListenerState.STOPPED);
        });
    }

    @Test
    void validate_LiveBeforeHistory_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(ListenerState.NOT_STARTED, ListenerState.LIVE)
        );
    }

    @Test
    void validate_StoppedToReadingHistory_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(ListenerState.STOPPED, ListenerState.READING_HISTORY)
        );
        assertTrue(ListenerState.STOPPED.isTerminal());
    }
}
