package com.ryuqq.eventflow.core.spi;

import com.ryuqq.eventflow.core.message.Message;

/**
 * Ordered single-consumer queue in front of a handler.
 *
 * <p>{@link #publish(Message)} and {@link #handle(Object)} both enqueue. Messages are delivered
 * to the inner handler in FIFO order by exactly one consumer at a time.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <ul>
 *   <li>{@link #start()} - starts the consumer; starting twice is an error</li>
 *   <li>{@link #requestStop()} - signals the consumer to stop and returns immediately</li>
 *   <li>{@link #stop()} - signals and blocks up to the configured timeout, then fails</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface QueuedHandler extends Handler<Message>, Publisher, MonitoredQueue {

    void start();

    /**
     * @throws com.ryuqq.eventflow.core.exception.QueueStopTimeoutException if the consumer does not stop in time
     */
    void stop();

    void requestStop();
}
