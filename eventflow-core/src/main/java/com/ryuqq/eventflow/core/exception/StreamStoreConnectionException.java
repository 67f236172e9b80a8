package com.ryuqq.eventflow.core.exception;

/**
 * 연결되지 않았거나 이미 닫힌 커넥션 사용.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamStoreConnectionException extends StreamStoreException {

    public StreamStoreConnectionException(String message) {
        super(message);
    }
}
