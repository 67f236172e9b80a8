package com.ryuqq.eventflow.core.spi;

import com.ryuqq.eventflow.core.message.Command;

/**
 * Bus plus command API.
 *
 * <p>At most one command handler per command type may be registered on a dispatcher.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Dispatcher extends Bus, CommandPublisher, AutoCloseable {

    /**
     * Registers the handler for a command type.
     *
     * @throws com.ryuqq.eventflow.core.exception.ExistingHandlerException if a handler is already registered
     */
    <T extends Command> Subscription subscribeCommandHandler(Class<T> type, CommandHandler<T> handler);

    <T extends Command> void unsubscribeCommandHandler(Class<T> type, CommandHandler<T> handler);

    @Override
    void close();
}
