package com.ryuqq.eventflow.core.message;

import java.util.UUID;

/**
 * 이미 발생한 사실(불변).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class Event extends Message implements CorrelatedMessage {

    private final UUID correlationId;
    private final UUID causationId;

    /**
     * 루트 이벤트 생성 (자기 자신으로 correlate).
     */
    protected Event() {
        this.correlationId = getMsgId();
        this.causationId = null;
    }

    /**
     * source 메시지에 의해 발생한 이벤트 생성.
     *
     * @param source 원인 메시지
     * @throws IllegalArgumentException source가 null인 경우
     */
    protected Event(Message source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.correlationId = CorrelatedMessage.correlationOf(source);
        this.causationId = source.getMsgId();
    }

    @Override
    public UUID getCorrelationId() {
        return correlationId;
    }

    @Override
    public UUID getCausationId() {
        return causationId;
    }
}
