package com.ryuqq.eventflow.core.spi;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Aggregate cache in front of a {@link Repository}.
 *
 * <p>Eviction policy is the owner's responsibility (no LRU/TTL).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AggregateCache extends AutoCloseable {

    /**
     * @return the aggregate at its latest version, or empty when it cannot be loaded
     */
    <T extends EventSource> Optional<T> getById(UUID id, Supplier<T> factory);

    /**
     * @return true when the save succeeded; a failed save evicts the entry
     */
    boolean save(EventSource aggregate);

    boolean remove(UUID id);

    void clear();

    @Override
    void close();
}
