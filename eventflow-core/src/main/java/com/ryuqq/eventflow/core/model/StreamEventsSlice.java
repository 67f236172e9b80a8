package com.ryuqq.eventflow.core.model;

import java.util.List;

/**
 * 한 번의 페이지 읽기 결과.
 *
 * <p>스트림이 없거나 삭제된 경우 이벤트 없는 센티널({@link StreamNotFoundSlice},
 * {@link StreamDeletedSlice})로 표현합니다.</p>
 *
 * <p><strong>불변식:</strong> 같은 방향으로 연속 읽을 때 {@code nextEventNumber}는
 * {@code endOfStream}까지 엄격하게 진행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed class StreamEventsSlice permits StreamNotFoundSlice, StreamDeletedSlice {

    private final String stream;
    private final long fromEventNumber;
    private final ReadDirection readDirection;
    private final List<RecordedEvent> events;
    private final long nextEventNumber;
    private final long lastEventNumber;
    private final boolean endOfStream;

    public StreamEventsSlice(
        String stream,
        long fromEventNumber,
        ReadDirection readDirection,
        List<RecordedEvent> events,
        long nextEventNumber,
        long lastEventNumber,
        boolean endOfStream
    ) {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream cannot be null, empty or whitespace");
        }
        if (readDirection == null) {
            throw new IllegalArgumentException("readDirection cannot be null");
        }
        this.stream = stream;
        this.fromEventNumber = fromEventNumber;
        this.readDirection = readDirection;
        this.events = events == null ? List.of() : List.copyOf(events);
        this.nextEventNumber = nextEventNumber;
        this.lastEventNumber = lastEventNumber;
        this.endOfStream = endOfStream;
    }

    public String getStream() {
        return stream;
    }

    public long getFromEventNumber() {
        return fromEventNumber;
    }

    public ReadDirection getReadDirection() {
        return readDirection;
    }

    public List<RecordedEvent> getEvents() {
        return events;
    }

    public long getNextEventNumber() {
        return nextEventNumber;
    }

    public long getLastEventNumber() {
        return lastEventNumber;
    }

    public boolean isEndOfStream() {
        return endOfStream;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{stream=" + stream + ", from=" + fromEventNumber
            + ", events=" + events.size() + ", next=" + nextEventNumber + ", end=" + endOfStream + "}";
    }
}
