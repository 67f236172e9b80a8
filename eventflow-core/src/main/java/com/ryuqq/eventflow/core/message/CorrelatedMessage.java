package com.ryuqq.eventflow.core.message;

import java.util.UUID;

/**
 * Correlation/Causation 체인을 가지는 메시지.
 *
 * <p>루트 메시지는 자기 자신의 msgId로 correlate 되고 causation은 null 입니다.
 * 다른 메시지로부터 생성된 메시지는 source의 correlationId를 상속하고
 * source의 msgId를 causationId로 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CorrelatedMessage {

    UUID getMsgId();

    UUID getCorrelationId();

    /**
     * @return 원인 메시지 ID (루트 메시지면 null)
     */
    UUID getCausationId();

    /**
     * source 메시지로부터 상속할 correlation ID 계산.
     *
     * @param source 원인 메시지
     * @return source가 correlated 이면 그 correlationId, 아니면 source의 msgId
     */
    static UUID correlationOf(Message source) {
        if (source instanceof CorrelatedMessage) {
            return ((CorrelatedMessage) source).getCorrelationId();
        }
        return source.getMsgId();
    }
}
