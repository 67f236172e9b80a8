/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the seams between the messaging runtime, the event-sourced
 * repository and the infrastructure adapters.</p>
 *
 * <h2>Messaging</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.core.spi.Bus} - synchronous publish/subscribe</li>
 *   <li>{@link com.ryuqq.eventflow.core.spi.QueuedHandler} - ordered single-consumer queue</li>
 *   <li>{@link com.ryuqq.eventflow.core.spi.Dispatcher} - bus plus blocking/non-blocking command API</li>
 * </ul>
 *
 * <h2>Persistence</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.core.spi.StreamStoreConnection} - external stream store</li>
 *   <li>{@link com.ryuqq.eventflow.core.spi.EventSerializer} - event ↔ bytes</li>
 *   <li>{@link com.ryuqq.eventflow.core.spi.Repository} / {@link com.ryuqq.eventflow.core.spi.AggregateCache} - aggregate load/save</li>
 *   <li>{@link com.ryuqq.eventflow.core.spi.EventSource} - aggregate contract consumed by the repository</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (eventflow-adapter-inmemory, eventflow-adapter-runner) and the application
 * layer provide the implementations.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.eventflow.core.spi;
