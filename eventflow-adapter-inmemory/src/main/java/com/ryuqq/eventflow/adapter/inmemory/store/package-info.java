/**
 * In-memory stream store adapter package.
 *
 * <p>{@link com.ryuqq.eventflow.adapter.inmemory.store.InMemoryStreamStoreConnection} implements
 * {@link com.ryuqq.eventflow.core.spi.StreamStoreConnection} for tests and embedded use.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Credentials are accepted and ignored</li>
 *   <li>Projection streams copy events rather than linking them</li>
 * </ul>
 *
 * @see com.ryuqq.eventflow.core.spi.StreamStoreConnection
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.adapter.inmemory.store;
