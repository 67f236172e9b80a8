package com.ryuqq.eventflow.core.model;

/**
 * 구독 종료 사유.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum SubscriptionDropReason {
    USER_INITIATED,
    CONNECTION_CLOSED,
    EVENT_HANDLER_EXCEPTION,
    PROCESSING_QUEUE_OVERFLOW,
    STREAM_DELETED,
    UNKNOWN
}
