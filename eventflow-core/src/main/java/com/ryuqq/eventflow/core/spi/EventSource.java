package com.ryuqq.eventflow.core.spi;

import java.util.List;
import java.util.UUID;

/**
 * Event-sourced aggregate as seen by the repository.
 *
 * <p><strong>Invariants:</strong></p>
 * <ul>
 *   <li>{@link #getExpectedVersion()} is the number of the last applied event, -1 when new</li>
 *   <li>after a save the stored stream version equals the expected version</li>
 *   <li>after a load the expected version equals the number of replayed events minus one</li>
 * </ul>
 *
 * <p>Instances are not thread-safe.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventSource {

    UUID getId();

    long getExpectedVersion();

    /**
     * Applies replayed events, advancing the expected version by one per event.
     */
    void restoreFromEvents(Iterable<Object> events);

    /**
     * Applies events read after {@code expectedVersion}.
     *
     * @throws IllegalStateException if {@code expectedVersion} is not the current expected version
     *         or uncommitted events are pending
     */
    void updateWithEvents(Iterable<Object> events, long expectedVersion);

    /**
     * Returns and clears the uncommitted events, advancing the expected version past them.
     */
    List<Object> takeEvents();
}
