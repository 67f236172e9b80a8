package com.ryuqq.eventflow.application.serialization;

/**
 * Raised when an event or its metadata cannot be converted to or from JSON.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventSerializationException extends RuntimeException {

    public EventSerializationException(String message) {
        super(message);
    }

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
