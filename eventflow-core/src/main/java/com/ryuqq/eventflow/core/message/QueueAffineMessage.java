package com.ryuqq.eventflow.core.message;

/**
 * 특정 큐 파티션에 고정되어야 하는 메시지.
 *
 * <p>MultiQueuedHandler는 해시 대신 {@link #queueId()}로 파티션을 선택합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface QueueAffineMessage {

    int queueId();
}
