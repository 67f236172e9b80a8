package com.ryuqq.eventflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 이미 저장된 이벤트.
 *
 * @param eventStreamId 이벤트가 속한 스트림
 * @param eventId 이벤트 ID
 * @param eventNumber 스트림 내 순번 (0부터)
 * @param eventType 타입 태그
 * @param data 페이로드
 * @param metadata 헤더 페이로드
 * @param isJson JSON 여부
 * @param created 저장 시각
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RecordedEvent(
    String eventStreamId,
    UUID eventId,
    long eventNumber,
    String eventType,
    byte[] data,
    byte[] metadata,
    boolean isJson,
    Instant created
) {

    public RecordedEvent {
        if (eventStreamId == null || eventStreamId.isBlank()) {
            throw new IllegalArgumentException("eventStreamId cannot be null or blank");
        }
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }
        data = data == null ? new byte[0] : data;
        metadata = metadata == null ? new byte[0] : metadata;
    }

    public long createdEpochMillis() {
        return created == null ? 0L : created.toEpochMilli();
    }

    @Override
    public String toString() {
        return "RecordedEvent{" + eventStreamId + "@" + eventNumber + ", type=" + eventType + "}";
    }
}
