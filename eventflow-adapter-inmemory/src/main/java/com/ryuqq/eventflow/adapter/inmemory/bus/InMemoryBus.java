package com.ryuqq.eventflow.adapter.inmemory.bus;

import com.ryuqq.eventflow.core.hierarchy.MessageHierarchy;
import com.ryuqq.eventflow.core.hierarchy.MessageTypesAddedListener;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.Bus;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory implementation of the {@link Bus} SPI.
 *
 * <p>Publishing is synchronous: every handler that matches the message's runtime type is
 * invoked on the publishing thread, in registration order.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Registrations:</strong> ordered list of (type, handler, includeDerived), guarded by one lock</li>
 *   <li><strong>Dispatch Map:</strong> concrete type → immutable handler snapshot, built from the
 *       {@link MessageHierarchy} ancestor chain and rebuilt when registrations or known types change</li>
 * </ul>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Subscribe to a type and all of its subtypes, including subtypes first seen later</li>
 *   <li>Duplicate subscription of the same handler for the same type is ignored</li>
 *   <li>Idempotent unsubscribe through {@link Subscription#close()}</li>
 *   <li>Slow handler instrumentation (WARN above the slow threshold, ERROR above the very slow one)</li>
 * </ul>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>A null message is logged and dropped</li>
 *   <li>Handler exceptions propagate to the publisher; later handlers are not invoked</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryBus bus = new InMemoryBus("orders");
 * Subscription subscription = bus.subscribe(OrderEvent.class, event -&gt; project(event));
 *
 * bus.publish(new OrderPlaced(orderId));   // handled: OrderPlaced extends OrderEvent
 *
 * subscription.close();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryBus implements Bus, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBus.class);

    private final String name;
    private final InMemoryBusConfig config;
    private final MessageHierarchy hierarchy;
    private final MessageTypesAddedListener typesAddedListener;

    /**
     * Registrations in subscribe order. Guarded by {@code lock}.
     */
    private final List<Registration> registrations = new ArrayList<>();

    /**
     * Dispatch snapshots per concrete type. Guarded by {@code lock} for writes.
     */
    private volatile Map<Class<?>, List<Registration>> dispatchMap = Map.of();

    private final Object lock = new Object();

    public InMemoryBus(String name) {
        this(name, new InMemoryBusConfig());
    }

    public InMemoryBus(String name, InMemoryBusConfig config) {
        this(name, config, new MessageHierarchy());
    }

    /**
     * Creates a bus.
     *
     * @param name bus name (used in logs)
     * @param config slow message settings
     * @param hierarchy type hierarchy, possibly shared with other buses
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryBus(String name, InMemoryBusConfig config, MessageHierarchy hierarchy) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (hierarchy == null) {
            throw new IllegalArgumentException("hierarchy cannot be null");
        }
        this.name = name;
        this.config = config;
        this.hierarchy = hierarchy;
        this.typesAddedListener = addedTypes -> invalidate();
        hierarchy.addListener(typesAddedListener);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends Message> Subscription subscribe(Class<T> type, Handler<? super T> handler, boolean includeDerived) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        hierarchy.register(type);

        Registration registration = new Registration(type, (Handler<Message>) handler, includeDerived);
        synchronized (lock) {
            for (Registration existing : registrations) {
                if (existing.type == type && existing.handler.equals(handler)) {
                    return new BusSubscription(type, handler);
                }
            }
            registrations.add(registration);
            dispatchMap = Map.of();
        }
        return new BusSubscription(type, handler);
    }

    @Override
    public <T extends Message> void unsubscribe(Class<T> type, Handler<? super T> handler) {
        if (type == null || handler == null) {
            return;
        }
        synchronized (lock) {
            boolean removed = registrations.removeIf(r -> r.type == type && r.handler.equals(handler));
            if (removed) {
                dispatchMap = Map.of();
            }
        }
    }

    @Override
    public boolean hasSubscriberFor(Class<? extends Message> type, boolean includeDerived) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        hierarchy.register(type);
        if (!handlersFor(type).isEmpty()) {
            return true;
        }
        if (!includeDerived) {
            return false;
        }
        for (Class<?> derived : hierarchy.descendantsAndSelf(type)) {
            if (!handlersFor(derived).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true when no handler is registered at all
     */
    public boolean noMessageHandlers() {
        synchronized (lock) {
            return registrations.isEmpty();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Unknown runtime types are registered in the hierarchy before dispatch</li>
     *   <li>The handler snapshot is taken once; subscriptions made during dispatch apply to the next publish</li>
     * </ul>
     */
    @Override
    public void publish(Message message) {
        if (message == null) {
            log.error("Message should not be null. Bus '{}' dropped it.", name);
            return;
        }
        Class<? extends Message> type = message.getClass();
        if (!hierarchy.isRegistered(type)) {
            hierarchy.register(type);
        }

        for (Registration registration : handlersFor(type)) {
            if (!config.watchSlowMsg()) {
                registration.handler.handle(message);
                continue;
            }
            long start = System.nanoTime();
            registration.handler.handle(message);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
            if (elapsedMs > config.slowMsgThreshold().toMillis()) {
                log.warn("SLOW BUS MSG [{}]: {} - {}ms. Handler: {}.",
                    name, type.getSimpleName(), elapsedMs, registration.handler);
                if (elapsedMs > config.verySlowMsgThreshold().toMillis()) {
                    log.error("---!!! VERY SLOW BUS MSG [{}]: {} - {}ms. Handler: {}.",
                        name, type.getSimpleName(), elapsedMs, registration.handler);
                }
            }
        }
    }

    private List<Registration> handlersFor(Class<?> type) {
        List<Registration> handlers = dispatchMap.get(type);
        if (handlers != null) {
            return handlers;
        }
        synchronized (lock) {
            handlers = dispatchMap.get(type);
            if (handlers != null) {
                return handlers;
            }
            handlers = buildHandlers(type);
            Map<Class<?>, List<Registration>> next = new HashMap<>(dispatchMap);
            next.put(type, handlers);
            dispatchMap = Collections.unmodifiableMap(next);
            return handlers;
        }
    }

    @SuppressWarnings("unchecked")
    private List<Registration> buildHandlers(Class<?> type) {
        List<Class<?>> ancestors = Message.class.isAssignableFrom(type)
            ? hierarchy.ancestorsAndSelf((Class<? extends Message>) type)
            : List.of(type);
        List<Registration> result = new ArrayList<>();
        for (Registration registration : registrations) {
            if (registration.type == type
                || (registration.includeDerived && ancestors.contains(registration.type))) {
                result.add(registration);
            }
        }
        return List.copyOf(result);
    }

    private void invalidate() {
        synchronized (lock) {
            dispatchMap = Map.of();
        }
    }

    /**
     * Removes every handler and detaches from the hierarchy.
     */
    @Override
    public void close() {
        synchronized (lock) {
            registrations.clear();
            dispatchMap = Map.of();
        }
        hierarchy.removeListener(typesAddedListener);
    }

    @Override
    public String toString() {
        return "InMemoryBus{name=" + name + "}";
    }

    private static final class Registration {
        private final Class<?> type;
        private final Handler<Message> handler;
        private final boolean includeDerived;

        private Registration(Class<?> type, Handler<Message> handler, boolean includeDerived) {
            this.type = type;
            this.handler = handler;
            this.includeDerived = includeDerived;
        }
    }

    private final class BusSubscription implements Subscription {
        private final Class<? extends Message> type;
        private final Handler<?> handler;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private BusSubscription(Class<? extends Message> type, Handler<?> handler) {
            this.type = type;
            this.handler = handler;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                synchronized (lock) {
                    boolean removed = registrations.removeIf(r -> r.type == type && r.handler.equals(handler));
                    if (removed) {
                        dispatchMap = Map.of();
                    }
                }
            }
        }
    }
}
