package com.ryuqq.eventflow.adapter.runner;

import java.time.Duration;

/**
 * QueuedHandler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>watchSlowMsg: 메시지 처리 시간 측정 여부 (기본 true)</li>
 *   <li>slowMsgThreshold: WARN 로그 임계값 (기본 48ms)</li>
 *   <li>verySlowMsgThreshold: ERROR 로그 임계값 (기본 7초)</li>
 *   <li>stopTimeout: stop() 대기 한도 (기본 10초)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param watchSlowMsg 처리 시간 측정 여부
 * @param slowMsgThreshold 느린 메시지 임계값 (양수)
 * @param verySlowMsgThreshold 매우 느린 메시지 임계값 (slowMsgThreshold 이상)
 * @param stopTimeout stop 대기 한도 (양수)
 */
public record QueuedHandlerConfig(
    boolean watchSlowMsg,
    Duration slowMsgThreshold,
    Duration verySlowMsgThreshold,
    Duration stopTimeout
) {

    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: watchSlowMsg=true, slowMsgThreshold=48ms, verySlowMsgThreshold=7s, stopTimeout=10s</p>
     */
    public QueuedHandlerConfig() {
        this(true, Duration.ofMillis(48), Duration.ofSeconds(7), DEFAULT_STOP_TIMEOUT);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueuedHandlerConfig {
        if (slowMsgThreshold == null || slowMsgThreshold.isNegative() || slowMsgThreshold.isZero()) {
            throw new IllegalArgumentException(
                "slowMsgThreshold must be positive (current: " + slowMsgThreshold + ")"
            );
        }
        if (verySlowMsgThreshold == null || verySlowMsgThreshold.compareTo(slowMsgThreshold) < 0) {
            throw new IllegalArgumentException(
                "verySlowMsgThreshold must not be below slowMsgThreshold (current: " + verySlowMsgThreshold + ")"
            );
        }
        if (stopTimeout == null || stopTimeout.isNegative() || stopTimeout.isZero()) {
            throw new IllegalArgumentException(
                "stopTimeout must be positive (current: " + stopTimeout + ")"
            );
        }
    }

    public QueuedHandlerConfig withWatchSlowMsg(boolean watchSlowMsg) {
        return new QueuedHandlerConfig(watchSlowMsg, slowMsgThreshold, verySlowMsgThreshold, stopTimeout);
    }

    public QueuedHandlerConfig withSlowMsgThreshold(Duration slowMsgThreshold) {
        return new QueuedHandlerConfig(watchSlowMsg, slowMsgThreshold, verySlowMsgThreshold, stopTimeout);
    }

    public QueuedHandlerConfig withVerySlowMsgThreshold(Duration verySlowMsgThreshold) {
        return new QueuedHandlerConfig(watchSlowMsg, slowMsgThreshold, verySlowMsgThreshold, stopTimeout);
    }

    /**
     * stopTimeout만 변경한 새 인스턴스 생성.
     */
    public QueuedHandlerConfig withStopTimeout(Duration stopTimeout) {
        return new QueuedHandlerConfig(watchSlowMsg, slowMsgThreshold, verySlowMsgThreshold, stopTimeout);
    }
}
