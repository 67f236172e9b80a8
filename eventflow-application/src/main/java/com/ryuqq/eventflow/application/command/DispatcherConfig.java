package com.ryuqq.eventflow.application.command;

import com.ryuqq.eventflow.adapter.inmemory.bus.InMemoryBusConfig;
import com.ryuqq.eventflow.adapter.runner.QueuedHandlerConfig;

import java.time.Duration;

/**
 * Dispatcher 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>queueCount: 1 (0이면 큐 없이 호출 스레드에서 버스로 직접 publish)</li>
 *   <li>ackTimeout: 100ms</li>
 *   <li>responseTimeout: 500ms</li>
 *   <li>busConfig / queueConfig: 각 기본 설정</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DispatcherConfig config = new DispatcherConfig()
 *     .withQueueCount(4)
 *     .withResponseTimeout(Duration.ofSeconds(2));
 * </pre>
 *
 * @param queueCount publish 파티션 수 (0 이상)
 * @param ackTimeout 핸들러가 Ack 해야 하는 시간
 * @param responseTimeout 핸들러가 응답해야 하는 시간
 * @param busConfig 내부 버스 설정
 * @param queueConfig publish 큐 설정
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record DispatcherConfig(
    int queueCount,
    Duration ackTimeout,
    Duration responseTimeout,
    InMemoryBusConfig busConfig,
    QueuedHandlerConfig queueConfig
) {

    public static final int DEFAULT_QUEUE_COUNT = 1;
    public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofMillis(100);
    public static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofMillis(500);

    public DispatcherConfig() {
        this(DEFAULT_QUEUE_COUNT, DEFAULT_ACK_TIMEOUT, DEFAULT_RESPONSE_TIMEOUT,
            new InMemoryBusConfig(), new QueuedHandlerConfig());
    }

    public DispatcherConfig {
        if (queueCount < 0) {
            throw new IllegalArgumentException("queueCount must not be negative (current: " + queueCount + ")");
        }
        requirePositive(ackTimeout, "ackTimeout");
        requirePositive(responseTimeout, "responseTimeout");
        if (busConfig == null) {
            throw new IllegalArgumentException("busConfig cannot be null");
        }
        if (queueConfig == null) {
            throw new IllegalArgumentException("queueConfig cannot be null");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    public DispatcherConfig withQueueCount(int queueCount) {
        return new DispatcherConfig(queueCount, ackTimeout, responseTimeout, busConfig, queueConfig);
    }

    public DispatcherConfig withAckTimeout(Duration ackTimeout) {
        return new DispatcherConfig(queueCount, ackTimeout, responseTimeout, busConfig, queueConfig);
    }

    public DispatcherConfig withResponseTimeout(Duration responseTimeout) {
        return new DispatcherConfig(queueCount, ackTimeout, responseTimeout, busConfig, queueConfig);
    }

    public DispatcherConfig withBusConfig(InMemoryBusConfig busConfig) {
        return new DispatcherConfig(queueCount, ackTimeout, responseTimeout, busConfig, queueConfig);
    }

    public DispatcherConfig withQueueConfig(QueuedHandlerConfig queueConfig) {
        return new DispatcherConfig(queueCount, ackTimeout, responseTimeout, busConfig, queueConfig);
    }
}
