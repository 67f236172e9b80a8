package com.ryuqq.eventflow.core.spi;

/**
 * Handle returned by subscribe operations.
 *
 * <p>{@link #close()} is idempotent: closing twice has the same effect as closing once.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
