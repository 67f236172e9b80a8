package com.ryuqq.eventflow.core.message;

import java.util.UUID;

/**
 * 모든 메시지의 루트 타입.
 *
 * <p>메시지는 생성 시점에 고유한 {@code msgId}를 한 번 할당받으며, 이 식별자는
 * 중복 제거와 추적(command tracking)에 사용됩니다. 식별자는 절대 변경되지 않습니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link Event} - 이미 일어난 사실</li>
 *   <li>{@link Command} - 상태 변경 요청</li>
 *   <li>{@link CommandResponse} - Command 처리 결과 (Success | Fail | Canceled)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class Message {

    private final UUID msgId;

    protected Message() {
        this.msgId = UUID.randomUUID();
    }

    public UUID getMsgId() {
        return msgId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{msgId=" + msgId + "}";
    }
}
