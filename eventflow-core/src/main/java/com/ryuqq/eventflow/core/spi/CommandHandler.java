package com.ryuqq.eventflow.core.spi;

import com.ryuqq.eventflow.core.message.Command;
import com.ryuqq.eventflow.core.message.CommandResponse;

/**
 * Handles one command type and returns its response.
 *
 * @param <T> command type
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandHandler<T extends Command> {

    CommandResponse handle(T command);
}
