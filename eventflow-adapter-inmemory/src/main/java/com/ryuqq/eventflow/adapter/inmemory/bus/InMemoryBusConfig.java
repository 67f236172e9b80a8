package com.ryuqq.eventflow.adapter.inmemory.bus;

import java.time.Duration;

/**
 * InMemoryBus configuration (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>watchSlowMsg: time each handler invocation (default true)</li>
 *   <li>slowMsgThreshold: WARN above this (default 48ms)</li>
 *   <li>verySlowMsgThreshold: ERROR above this (default 7s)</li>
 * </ul>
 *
 * @param watchSlowMsg whether handler invocations are timed
 * @param slowMsgThreshold slow handler threshold (positive)
 * @param verySlowMsgThreshold very slow handler threshold (not below slowMsgThreshold)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InMemoryBusConfig(
    boolean watchSlowMsg,
    Duration slowMsgThreshold,
    Duration verySlowMsgThreshold
) {

    public static final Duration DEFAULT_SLOW_MSG_THRESHOLD = Duration.ofMillis(48);
    public static final Duration DEFAULT_VERY_SLOW_MSG_THRESHOLD = Duration.ofSeconds(7);

    /**
     * Defaults: watchSlowMsg=true, slowMsgThreshold=48ms, verySlowMsgThreshold=7s.
     */
    public InMemoryBusConfig() {
        this(true, DEFAULT_SLOW_MSG_THRESHOLD, DEFAULT_VERY_SLOW_MSG_THRESHOLD);
    }

    public InMemoryBusConfig {
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
    }

    public InMemoryBusConfig withWatchSlowMsg(boolean watchSlowMsg) {
        return new InMemoryBusConfig(watchSlowMsg, slowMsgThreshold, verySlowMsgThreshold);
    }

    public InMemoryBusConfig withSlowMsgThreshold(Duration slowMsgThreshold) {
        return new InMemoryBusConfig(watchSlowMsg, slowMsgThreshold, verySlowMsgThreshold);
    }

    public InMemoryBusConfig withVerySlowMsgThreshold(Duration verySlowMsgThreshold) {
        return new InMemoryBusConfig(watchSlowMsg, slowMsgThreshold, verySlowMsgThreshold);
    }
}
