/**
 * In-memory message bus adapter package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.adapter.inmemory.bus.InMemoryBus}:
 *       synchronous, hierarchy-aware implementation of {@link com.ryuqq.eventflow.core.spi.Bus}</li>
 *   <li>{@link com.ryuqq.eventflow.adapter.inmemory.bus.InMemoryBusConfig}: slow handler thresholds</li>
 * </ul>
 *
 * <p><strong>Dispatch Rules:</strong></p>
 * <ul>
 *   <li>A handler subscribed to {@code T} receives every message whose runtime type is {@code T}
 *       or, when derived delivery is on, a subtype of {@code T}</li>
 *   <li>Handlers run on the publishing thread in subscription order</li>
 * </ul>
 *
 * @see com.ryuqq.eventflow.core.hierarchy.MessageHierarchy
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.adapter.inmemory.bus;
