package com.ryuqq.eventflow.core.spi;

/**
 * Message handler registered on a {@link Subscriber}.
 *
 * <p>Handlers are resolved at subscribe time against the message type hierarchy,
 * never by runtime type switching at publish time.</p>
 *
 * @param <T> handled message type
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Handler<T> {

    void handle(T message);
}
