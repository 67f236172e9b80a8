package com.ryuqq.eventflow.core.model;

import java.util.UUID;

/**
 * 저장할 이벤트 한 건 (wire 표현).
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>eventId는 null이나 0 UUID가 될 수 없음 (멱등 append에 사용)</li>
 *   <li>data/metadata는 null 대신 빈 배열</li>
 * </ul>
 *
 * @param eventId 이벤트 ID
 * @param eventType 타입 태그
 * @param isJson JSON 여부
 * @param data 페이로드
 * @param metadata 헤더 페이로드
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventData(
    UUID eventId,
    String eventType,
    boolean isJson,
    byte[] data,
    byte[] metadata
) {

    private static final UUID EMPTY_ID = new UUID(0L, 0L);
    private static final byte[] EMPTY = new byte[0];

    public EventData {
        if (eventId == null || EMPTY_ID.equals(eventId)) {
            throw new IllegalArgumentException("eventId cannot be null or empty");
        }
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        data = data == null ? EMPTY : data;
        metadata = metadata == null ? EMPTY : metadata;
    }
}
