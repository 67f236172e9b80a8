package com.ryuqq.eventflow.core.spi;

/**
 * Queue that can be registered for process-wide introspection.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MonitoredQueue {

    String getName();

    int messageCount();

    /**
     * @return true when the queue is empty and no message is being dispatched
     */
    boolean isIdle();

    long processedCount();
}
