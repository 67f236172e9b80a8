package com.ryuqq.eventflow.core.exception;

/**
 * 스트림이 영구 삭제(hard delete)됨.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamDeletedException extends StreamStoreException {

    private final String stream;

    public StreamDeletedException(String stream) {
        super("Stream '" + stream + "' is deleted.");
        this.stream = stream;
    }

    public String getStream() {
        return stream;
    }
}
