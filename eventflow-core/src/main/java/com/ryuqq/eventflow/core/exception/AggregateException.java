package com.ryuqq.eventflow.core.exception;

import java.util.UUID;

/**
 * Aggregate 로드/저장 실패의 공통 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AggregateException extends RuntimeException {

    private final UUID id;
    private final Class<?> type;

    protected AggregateException(String message, UUID id, Class<?> type) {
        this(message, id, type, null);
    }

    protected AggregateException(String message, UUID id, Class<?> type, Throwable cause) {
        super(message, cause);
        this.id = id;
        this.type = type;
    }

    public UUID getId() {
        return id;
    }

    public Class<?> getType() {
        return type;
    }

    static String nameOf(Class<?> type) {
        return type == null ? "Aggregate" : type.getSimpleName();
    }
}
