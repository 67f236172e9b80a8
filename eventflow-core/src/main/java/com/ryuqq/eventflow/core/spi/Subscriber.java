package com.ryuqq.eventflow.core.spi;

import com.ryuqq.eventflow.core.message.Message;

/**
 * Subscribing side of a bus.
 *
 * <p><strong>Semantics:</strong></p>
 * <ul>
 *   <li>{@code includeDerived = true}: the handler also fires for every subtype of {@code type},
 *       including subtypes first seen after the subscription was made</li>
 *   <li>The same handler instance is registered at most once per type</li>
 *   <li>Unsubscribing is idempotent</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Subscriber {

    /**
     * Subscribes a handler to {@code type} and its subtypes.
     */
    default <T extends Message> Subscription subscribe(Class<T> type, Handler<? super T> handler) {
        return subscribe(type, handler, true);
    }

    /**
     * Subscribes a handler.
     *
     * @param type message type
     * @param handler handler to invoke
     * @param includeDerived whether subtypes of {@code type} are delivered as well
     * @return subscription whose close unsubscribes the handler
     * @throws IllegalArgumentException if type or handler is null
     */
    <T extends Message> Subscription subscribe(Class<T> type, Handler<? super T> handler, boolean includeDerived);

    /**
     * Subscribes a handler to every message.
     */
    default Subscription subscribeToAll(Handler<? super Message> handler) {
        return subscribe(Message.class, handler, true);
    }

    /**
     * Removes a handler from {@code type}. No-op when not subscribed.
     */
    <T extends Message> void unsubscribe(Class<T> type, Handler<? super T> handler);

    default void unsubscribeFromAll(Handler<? super Message> handler) {
        unsubscribe(Message.class, handler);
    }

    /**
     * Reports whether publishing a message of {@code type} would invoke any handler.
     *
     * @param type message type
     * @param includeDerived also consider handlers registered for subtypes of {@code type}
     */
    boolean hasSubscriberFor(Class<? extends Message> type, boolean includeDerived);
}
