package com.ryuqq.eventflow.core.model;

import java.util.List;

/**
 * 스트림 없음 센티널.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StreamNotFoundSlice extends StreamEventsSlice {

    public StreamNotFoundSlice(String stream, long fromEventNumber, ReadDirection readDirection) {
        super(stream, fromEventNumber, readDirection, List.of(), ExpectedVersion.NO_STREAM, ExpectedVersion.NO_STREAM, true);
    }
}
