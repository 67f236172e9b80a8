package com.ryuqq.eventflow.core.exception;

import java.util.UUID;

/**
 * Aggregate 스트림이 존재하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AggregateNotFoundException extends AggregateException {

    public AggregateNotFoundException(UUID id, Class<?> type) {
        super("Aggregate '" + id + "' (type " + nameOf(type) + ") was not found.", id, type);
    }

    public AggregateNotFoundException(UUID id, Class<?> type, Throwable cause) {
        super("Aggregate '" + id + "' (type " + nameOf(type) + ") was not found.", id, type, cause);
    }
}
