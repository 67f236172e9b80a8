package com.ryuqq.eventflow.core.spi;

import com.ryuqq.eventflow.core.model.CatchUpSubscriptionSettings;
import com.ryuqq.eventflow.core.model.EventData;
import com.ryuqq.eventflow.core.model.RecordedEvent;
import com.ryuqq.eventflow.core.model.StreamEventsSlice;
import com.ryuqq.eventflow.core.model.SubscriptionDropReason;
import com.ryuqq.eventflow.core.model.UserCredentials;
import com.ryuqq.eventflow.core.model.WriteResult;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Stream store SPI: append, paged read, subscribe and delete primitives.
 *
 * <p>Payloads crossing this boundary are opaque byte arrays. The wire protocol of any concrete
 * store is the adapter's business.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Append rejects a mismatched expected version with
 *       {@link com.ryuqq.eventflow.core.exception.WrongExpectedVersionException}</li>
 *   <li>Reads of an absent or deleted stream return the not-found/deleted slice sentinels</li>
 *   <li>Catch-up subscriptions deliver history, then call {@code liveProcessingStarted} once,
 *       then live events; never a live event before history</li>
 *   <li>Thread-safe</li>
 * </ul>
 *
 * <p>Null credentials mean "connection defaults".</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StreamStoreConnection extends AutoCloseable {

    /**
     * Connection name, used to tell connections apart in logs.
     */
    String getConnectionName();

    void connect();

    @Override
    void close();

    default WriteResult appendToStream(String stream, long expectedVersion, EventData... events) {
        return appendToStream(stream, expectedVersion, null, events);
    }

    /**
     * Appends events at {@code expectedVersion}.
     *
     * @param stream stream name
     * @param expectedVersion last event number the caller has seen, or an {@link com.ryuqq.eventflow.core.model.ExpectedVersion} constant
     * @param credentials user credentials (nullable)
     * @param events events to append
     * @return write result carrying the next expected version
     */
    WriteResult appendToStream(String stream, long expectedVersion, UserCredentials credentials, EventData... events);

    default StreamEventsSlice readStreamForward(String stream, long start, long count) {
        return readStreamForward(stream, start, count, null);
    }

    /**
     * Reads up to {@code count} events, oldest first, starting at {@code start}.
     */
    StreamEventsSlice readStreamForward(String stream, long start, long count, UserCredentials credentials);

    default StreamEventsSlice readStreamBackward(String stream, long start, long count) {
        return readStreamBackward(stream, start, count, null);
    }

    /**
     * Reads up to {@code count} events, newest first, starting at {@code start} ({@code -1} = end of stream).
     */
    StreamEventsSlice readStreamBackward(String stream, long start, long count, UserCredentials credentials);

    /**
     * Live-only subscription to one stream.
     */
    Subscription subscribeToStream(
        String stream,
        Consumer<RecordedEvent> eventAppeared,
        BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped,
        UserCredentials credentials
    );

    /**
     * Catch-up subscription: replays events after {@code lastCheckpoint} (exclusive, null = from the start),
     * then switches to live delivery.
     */
    Subscription subscribeToStreamFrom(
        String stream,
        Long lastCheckpoint,
        CatchUpSubscriptionSettings settings,
        Consumer<RecordedEvent> eventAppeared,
        Runnable liveProcessingStarted,
        BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped,
        UserCredentials credentials
    );

    /**
     * Live-only subscription to every appended event.
     */
    Subscription subscribeToAll(
        Consumer<RecordedEvent> eventAppeared,
        BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped,
        UserCredentials credentials
    );

    default void deleteStream(String stream, long expectedVersion) {
        deleteStream(stream, expectedVersion, null);
    }

    /**
     * Soft delete: the stream can be recreated by appending.
     */
    void deleteStream(String stream, long expectedVersion, UserCredentials credentials);

    default void hardDeleteStream(String stream, long expectedVersion) {
        hardDeleteStream(stream, expectedVersion, null);
    }

    /**
     * Hard delete: the stream can never be written again.
     */
    void hardDeleteStream(String stream, long expectedVersion, UserCredentials credentials);
}
