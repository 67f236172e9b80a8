package com.ryuqq.eventflow.core.exception;

/**
 * 스트림이 존재하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamNotFoundException extends StreamStoreException {

    private final String stream;

    public StreamNotFoundException(String stream) {
        super("Stream '" + stream + "' not found.");
        this.stream = stream;
    }

    public String getStream() {
        return stream;
    }
}
