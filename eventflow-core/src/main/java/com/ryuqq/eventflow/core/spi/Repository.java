package com.ryuqq.eventflow.core.spi;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Aggregate persistence.
 *
 * <p>Aggregates are created by the caller-supplied factory; no reflective construction.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Repository {

    /**
     * Version sentinel meaning "latest".
     */
    long LATEST = Integer.MAX_VALUE;

    default <T extends EventSource> T getById(UUID id, Supplier<T> factory) {
        return getById(id, LATEST, factory);
    }

    /**
     * Loads an aggregate by replaying its stream up to {@code version} events.
     *
     * @throws com.ryuqq.eventflow.core.exception.AggregateNotFoundException stream absent
     * @throws com.ryuqq.eventflow.core.exception.AggregateDeletedException stream deleted
     * @throws com.ryuqq.eventflow.core.exception.AggregateVersionException replayed version mismatch
     * @throws IllegalStateException {@code version <= 0}
     */
    <T extends EventSource> T getById(UUID id, long version, Supplier<T> factory);

    default <T extends EventSource> Optional<T> tryGetById(UUID id, Supplier<T> factory) {
        return tryGetById(id, LATEST, factory);
    }

    /**
     * Like {@link #getById(UUID, long, Supplier)} but never throws.
     */
    <T extends EventSource> Optional<T> tryGetById(UUID id, long version, Supplier<T> factory);

    /**
     * Applies, in place, the events after the aggregate's current version up to {@code version}.
     *
     * @throws IllegalStateException target version below the current version
     */
    void update(EventSource aggregate, long version);

    default void updateToCurrent(EventSource aggregate) {
        update(aggregate, LATEST);
    }

    /**
     * Appends the pending events at the aggregate's expected version.
     *
     * @throws com.ryuqq.eventflow.core.exception.WrongExpectedVersionException concurrency conflict
     */
    void save(EventSource aggregate);

    /**
     * Soft delete. Further appends recreate the stream.
     */
    void delete(EventSource aggregate);

    /**
     * Permanent delete. Further appends fail.
     */
    void hardDelete(EventSource aggregate);
}
