package com.ryuqq.eventflow.core.exception;

/**
 * 스트림 스토어 연산 실패의 공통 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamStoreException extends RuntimeException {

    public StreamStoreException(String message) {
        super(message);
    }

    public StreamStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
