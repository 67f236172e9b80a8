package com.ryuqq.eventflow.core.exception;

import java.util.UUID;

/**
 * Aggregate 스트림이 삭제됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AggregateDeletedException extends AggregateException {

    public AggregateDeletedException(UUID id, Class<?> type) {
        super("Aggregate '" + id + "' (type " + nameOf(type) + ") was deleted.", id, type);
    }
}
