package com.ryuqq.eventflow.core.message;

import com.ryuqq.eventflow.core.time.TimePosition;
import com.ryuqq.eventflow.core.time.TimeSource;

import java.time.Duration;

/**
 * 지연 전송 요청.
 *
 * <p>{@code at} 시점이 지나면 LaterService가 {@code toSend}를 대상 Publisher로 발행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DelaySendEnvelope extends Message {

    private final TimePosition at;
    private final Message toSend;

    public DelaySendEnvelope(TimePosition at, Message toSend) {
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        if (toSend == null) {
            throw new IllegalArgumentException("toSend cannot be null");
        }
        this.at = at;
        this.toSend = toSend;
    }

    /**
     * 현재 시각 기준 지연 전송 요청 생성.
     *
     * @param timeSource 시계
     * @param delay 지연 시간
     * @param toSend 전송할 메시지
     */
    public DelaySendEnvelope(TimeSource timeSource, Duration delay, Message toSend) {
        this(requireTimeSource(timeSource).now().plus(delay), toSend);
    }

    private static TimeSource requireTimeSource(TimeSource timeSource) {
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        return timeSource;
    }

    public TimePosition getAt() {
        return at;
    }

    public Message getToSend() {
        return toSend;
    }

    @Override
    public String toString() {
        return "DelaySendEnvelope{at=" + at + ", toSend=" + toSend + "}";
    }
}
