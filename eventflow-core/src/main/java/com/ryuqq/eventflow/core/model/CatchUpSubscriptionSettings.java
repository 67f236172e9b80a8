package com.ryuqq.eventflow.core.model;

/**
 * Catch-up 구독 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxLiveQueueSize: live 이벤트 버퍼 최대 크기 (기본 10000)</li>
 *   <li>readBatchSize: 과거 이벤트 페이지 크기 (기본 500, 최대 {@value #MAX_READ_SIZE})</li>
 *   <li>verboseLogging: 상세 로그 여부 (기본 false)</li>
 *   <li>subscriptionName: 구독 이름 (기본 "")</li>
 * </ul>
 *
 * @param maxLiveQueueSize live 버퍼 최대 크기 (양수)
 * @param readBatchSize 페이지 크기 (양수, MAX_READ_SIZE 이하)
 * @param verboseLogging 상세 로그 여부
 * @param subscriptionName 구독 이름
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CatchUpSubscriptionSettings(
    int maxLiveQueueSize,
    int readBatchSize,
    boolean verboseLogging,
    String subscriptionName
) {

    public static final int MAX_READ_SIZE = 4096;

    public static final CatchUpSubscriptionSettings DEFAULT = new CatchUpSubscriptionSettings();

    public CatchUpSubscriptionSettings() {
        this(10000, 500, false, "");
    }

    public CatchUpSubscriptionSettings {
        if (maxLiveQueueSize <= 0) {
            throw new IllegalArgumentException(
                "maxLiveQueueSize must be positive (current: " + maxLiveQueueSize + ")"
            );
        }
        if (readBatchSize <= 0) {
            throw new IllegalArgumentException(
                "readBatchSize must be positive (current: " + readBatchSize + ")"
            );
        }
        if (readBatchSize > MAX_READ_SIZE) {
            throw new IllegalArgumentException(
                "Read batch size should be less than " + MAX_READ_SIZE + ". For larger reads you should page."
            );
        }
        subscriptionName = subscriptionName == null ? "" : subscriptionName;
    }

    public CatchUpSubscriptionSettings withMaxLiveQueueSize(int maxLiveQueueSize) {
        return new CatchUpSubscriptionSettings(maxLiveQueueSize, readBatchSize, verboseLogging, subscriptionName);
    }

    public CatchUpSubscriptionSettings withReadBatchSize(int readBatchSize) {
        return new CatchUpSubscriptionSettings(maxLiveQueueSize, readBatchSize, verboseLogging, subscriptionName);
    }

    public CatchUpSubscriptionSettings withVerboseLogging(boolean verboseLogging) {
        return new CatchUpSubscriptionSettings(maxLiveQueueSize, readBatchSize, verboseLogging, subscriptionName);
    }

    public CatchUpSubscriptionSettings withSubscriptionName(String subscriptionName) {
        return new CatchUpSubscriptionSettings(maxLiveQueueSize, readBatchSize, verboseLogging, subscriptionName);
    }
}
