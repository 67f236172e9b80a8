package com.ryuqq.eventflow.core.spi;

import com.ryuqq.eventflow.core.message.Message;

/**
 * Publishing side of a bus or queue.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Publisher {

    void publish(Message message);
}
