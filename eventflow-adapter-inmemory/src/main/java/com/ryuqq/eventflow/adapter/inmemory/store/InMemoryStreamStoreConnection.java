package com.ryuqq.eventflow.adapter.inmemory.store;

import com.ryuqq.eventflow.core.exception.StreamDeletedException;
import com.ryuqq.eventflow.core.exception.StreamNotFoundException;
import com.ryuqq.eventflow.core.exception.StreamStoreConnectionException;
import com.ryuqq.eventflow.core.exception.WrongExpectedVersionException;
import com.ryuqq.eventflow.core.model.CatchUpSubscriptionSettings;
import com.ryuqq.eventflow.core.model.EventData;
import com.ryuqq.eventflow.core.model.ExpectedVersion;
import com.ryuqq.eventflow.core.model.ReadDirection;
import com.ryuqq.eventflow.core.model.RecordedEvent;
import com.ryuqq.eventflow.core.model.StreamDeletedSlice;
import com.ryuqq.eventflow.core.model.StreamEventsSlice;
import com.ryuqq.eventflow.core.model.StreamNotFoundSlice;
import com.ryuqq.eventflow.core.model.SubscriptionDropReason;
import com.ryuqq.eventflow.core.model.UserCredentials;
import com.ryuqq.eventflow.core.model.WriteResult;
import com.ryuqq.eventflow.core.spi.StreamStoreConnection;
import com.ryuqq.eventflow.core.spi.Subscription;
import com.ryuqq.eventflow.core.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * In-memory implementation of the {@link StreamStoreConnection} SPI.
 *
 * <p>Streams live in a plain map guarded by a single lock, so appends, reads, deletes and
 * subscription registration are totally ordered. Event numbers start at 0 per stream.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Streams:</strong> stream name → events (index = event number), truncation point, delete flags</li>
 *   <li><strong>Projections:</strong> every append to a non-system stream is copied to
 *       {@code $ce-<category>} (text before the first '-') and {@code $et-<eventType>}</li>
 *   <li><strong>Subscriptions:</strong> one daemon thread and one FIFO queue per subscription</li>
 * </ul>
 *
 * <p><strong>Delete Semantics:</strong></p>
 * <ul>
 *   <li>Soft delete: reads return a deleted slice until the next append recreates the stream;
 *       numbering continues after the last deleted event</li>
 *   <li>Hard delete: reads return a deleted slice and appends throw {@link StreamDeletedException} forever</li>
 * </ul>
 *
 * <p><strong>Catch-up Ordering:</strong> history after the checkpoint, then the live marker, then live
 * events. History is enqueued and the subscription registered under the store lock, so no append
 * can slip between them.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryStreamStoreConnection connection = new InMemoryStreamStoreConnection("test");
 * connection.connect();
 *
 * connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, eventData);
 * StreamEventsSlice slice = connection.readStreamForward("account-1", 0, 500);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryStreamStoreConnection implements StreamStoreConnection {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStreamStoreConnection.class);

    /**
     * Backward read start meaning "from the last event".
     */
    public static final long END = -1L;

    private static final String CATEGORY_PREFIX = "$ce-";
    private static final String EVENT_TYPE_PREFIX = "$et-";

    private final String connectionName;
    private final DaemonThreadFactory threadFactory;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    private final Object lock = new Object();
    private final Map<String, StreamState> streams = new HashMap<>();
    private final Map<String, List<StoreSubscription>> streamSubscriptions = new HashMap<>();
    private final List<StoreSubscription> allSubscriptions = new CopyOnWriteArrayList<>();

    public InMemoryStreamStoreConnection() {
        this("in-memory-store");
    }

    public InMemoryStreamStoreConnection(String connectionName) {
        if (connectionName == null || connectionName.isBlank()) {
            throw new IllegalArgumentException("connectionName cannot be null or blank");
        }
        this.connectionName = connectionName;
        this.threadFactory = new DaemonThreadFactory(connectionName + "-subscription");
    }

    @Override
    public String getConnectionName() {
        return connectionName;
    }

    @Override
    public void connect() {
        if (connected.compareAndSet(false, true)) {
            log.debug("Stream store connection '{}' connected.", connectionName);
        }
    }

    /**
     * Disconnects and drops every subscription with {@link SubscriptionDropReason#CONNECTION_CLOSED}.
     * Stored streams survive a reconnect.
     */
    @Override
    public void close() {
        if (!connected.compareAndSet(true, false)) {
            return;
        }
        List<StoreSubscription> toDrop = new ArrayList<>(allSubscriptions);
        synchronized (lock) {
            streamSubscriptions.values().forEach(toDrop::addAll);
        }
        for (StoreSubscription subscription : toDrop) {
            subscription.drop(SubscriptionDropReason.CONNECTION_CLOSED, null);
        }
        log.debug("Stream store connection '{}' closed.", connectionName);
    }

    public boolean isConnected() {
        return connected.get();
    }

    // ========== Append ==========

    @Override
    public WriteResult appendToStream(String stream, long expectedVersion, UserCredentials credentials, EventData... events) {
        ensureConnected();
        validateStream(stream);
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }

        synchronized (lock) {
            StreamState state = streams.get(stream);
            if (state != null && state.hardDeleted) {
                throw new StreamDeletedException(stream);
            }
            checkExpectedVersion(stream, state, expectedVersion);

            if (events.length == 0) {
                return new WriteResult(state == null ? ExpectedVersion.NO_STREAM : state.lastEventNumber());
            }
            if (state == null) {
                state = new StreamState();
                streams.put(stream, state);
            }
            state.softDeleted = false;

            Instant now = Instant.now();
            List<RecordedEvent> appended = new ArrayList<>(events.length);
            for (EventData data : events) {
                if (data == null) {
                    throw new IllegalArgumentException("event cannot be null");
                }
                appended.add(state.append(stream, data, now));
            }
            publishLive(stream, appended);

            if (!stream.startsWith("$")) {
                for (RecordedEvent event : appended) {
                    project(categoryStreamOf(stream), event);
                    project(EVENT_TYPE_PREFIX + event.eventType(), event);
                }
                for (StoreSubscription subscription : allSubscriptions) {
                    appended.forEach(subscription::enqueueLive);
                }
            }
            return new WriteResult(state.lastEventNumber());
        }
    }

    private void project(String projectionStream, RecordedEvent source) {
        StreamState projection = streams.computeIfAbsent(projectionStream, s -> new StreamState());
        if (projection.hardDeleted) {
            return;
        }
        projection.softDeleted = false;
        EventData data = new EventData(source.eventId(), source.eventType(), source.isJson(), source.data(), source.metadata());
        RecordedEvent projected = projection.append(projectionStream, data, source.created());
        publishLive(projectionStream, List.of(projected));
    }

    private void publishLive(String stream, List<RecordedEvent> events) {
        List<StoreSubscription> subscriptions = streamSubscriptions.get(stream);
        if (subscriptions == null) {
            return;
        }
        for (StoreSubscription subscription : List.copyOf(subscriptions)) {
            events.forEach(subscription::enqueueLive);
        }
    }

    static String categoryStreamOf(String stream) {
        int dash = stream.indexOf('-');
        return CATEGORY_PREFIX + (dash < 0 ? stream : stream.substring(0, dash));
    }

    private static void checkExpectedVersion(String stream, StreamState state, long expectedVersion) {
        boolean exists = state != null && !state.softDeleted;
        long current = state == null ? ExpectedVersion.NO_STREAM : state.lastEventNumber();

        if (expectedVersion == ExpectedVersion.ANY) {
            return;
        }
        if (expectedVersion == ExpectedVersion.NO_STREAM) {
            if (exists) {
                throw wrongVersion(stream, expectedVersion, current);
            }
            return;
        }
        if (expectedVersion == ExpectedVersion.STREAM_EXISTS) {
            if (!exists) {
                throw wrongVersion(stream, expectedVersion, current);
            }
            return;
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Unsupported expectedVersion: " + expectedVersion);
        }
        if (state == null || current != expectedVersion) {
            throw wrongVersion(stream, expectedVersion, current);
        }
    }

    private static WrongExpectedVersionException wrongVersion(String stream, long expected, long current) {
        return new WrongExpectedVersionException(
            "Append failed due to WrongExpectedVersion. Stream: " + stream
                + ", Expected version: " + expected + ", Current version: " + current
        );
    }

    // ========== Read ==========

    @Override
    public StreamEventsSlice readStreamForward(String stream, long start, long count, UserCredentials credentials) {
        ensureConnected();
        validateStream(stream);
        validateRead(count);
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative (current: " + start + ")");
        }

        synchronized (lock) {
            StreamState state = streams.get(stream);
            if (state == null) {
                return new StreamNotFoundSlice(stream, start, ReadDirection.FORWARD);
            }
            if (state.isDeleted()) {
                return new StreamDeletedSlice(stream, start, ReadDirection.FORWARD);
            }

            int size = state.events.size();
            long from = Math.max(start, state.truncateBefore);
            long end = Math.min(from + count, size);
            List<RecordedEvent> page = from >= size
                ? List.of()
                : new ArrayList<>(state.events.subList((int) from, (int) end));
            long next = Math.max(end, from);
            return new StreamEventsSlice(
                stream, start, ReadDirection.FORWARD, page, next, state.lastEventNumber(), next >= size
            );
        }
    }

    @Override
    public StreamEventsSlice readStreamBackward(String stream, long start, long count, UserCredentials credentials) {
        ensureConnected();
        validateStream(stream);
        validateRead(count);
        if (start < END) {
            throw new IllegalArgumentException("start must be -1 or greater (current: " + start + ")");
        }

        synchronized (lock) {
            StreamState state = streams.get(stream);
            if (state == null) {
                return new StreamNotFoundSlice(stream, start, ReadDirection.BACKWARD);
            }
            if (state.isDeleted()) {
                return new StreamDeletedSlice(stream, start, ReadDirection.BACKWARD);
            }

            long last = state.lastEventNumber();
            long from = start == END ? last : Math.min(start, last);
            long lowest = Math.max(from - count + 1, state.truncateBefore);
            List<RecordedEvent> page = new ArrayList<>();
            for (long i = from; i >= lowest; i--) {
                page.add(state.events.get((int) i));
            }
            long next = lowest - 1;
            boolean endOfStream = next < state.truncateBefore;
            return new StreamEventsSlice(
                stream, start, ReadDirection.BACKWARD, page, endOfStream ? END : next, last, endOfStream
            );
        }
    }

    private static void validateRead(long count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
        if (count > CatchUpSubscriptionSettings.MAX_READ_SIZE) {
            throw new IllegalArgumentException(
                "Count should be less than " + CatchUpSubscriptionSettings.MAX_READ_SIZE + ". For larger reads you should page."
            );
        }
    }

    // ========== Delete ==========

    @Override
    public void deleteStream(String stream, long expectedVersion, UserCredentials credentials) {
        ensureConnected();
        validateStream(stream);
        synchronized (lock) {
            StreamState state = requireDeletable(stream, expectedVersion);
            state.softDeleted = true;
            state.truncateBefore = state.lastEventNumber() + 1;
        }
        log.debug("Stream '{}' soft deleted.", stream);
    }

    @Override
    public void hardDeleteStream(String stream, long expectedVersion, UserCredentials credentials) {
        ensureConnected();
        validateStream(stream);
        List<StoreSubscription> toDrop;
        synchronized (lock) {
            StreamState state = requireDeletable(stream, expectedVersion);
            state.hardDeleted = true;
            List<StoreSubscription> subscriptions = streamSubscriptions.remove(stream);
            toDrop = subscriptions == null ? List.of() : new ArrayList<>(subscriptions);
        }
        for (StoreSubscription subscription : toDrop) {
            subscription.drop(SubscriptionDropReason.STREAM_DELETED, null);
        }
        log.debug("Stream '{}' hard deleted.", stream);
    }

    private StreamState requireDeletable(String stream, long expectedVersion) {
        StreamState state = streams.get(stream);
        if (state == null) {
            throw new StreamNotFoundException(stream);
        }
        if (state.hardDeleted) {
            throw new StreamDeletedException(stream);
        }
        checkExpectedVersion(stream, state, expectedVersion);
        return state;
    }

    // ========== Subscribe ==========

    @Override
    public Subscription subscribeToStream(
        String stream,
        Consumer<RecordedEvent> eventAppeared,
        BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped,
        UserCredentials credentials
    ) {
        ensureConnected();
        validateStream(stream);
        StoreSubscription subscription = new StoreSubscription(
            stream, eventAppeared, null, subscriptionDropped, CatchUpSubscriptionSettings.DEFAULT.maxLiveQueueSize()
        );
        boolean deleted;
        synchronized (lock) {
            StreamState state = streams.get(stream);
            deleted = state != null && state.hardDeleted;
            if (!deleted) {
                register(subscription);
            }
        }
        subscription.start(threadFactory);
        if (deleted) {
            subscription.drop(SubscriptionDropReason.STREAM_DELETED, null);
        }
        return subscription;
    }

    /**
     * {@inheritDoc}
     *
     * <p>{@code lastCheckpoint} is exclusive; null replays from the first event.</p>
     */
    @Override
    public Subscription subscribeToStreamFrom(
        String stream,
        Long lastCheckpoint,
        CatchUpSubscriptionSettings settings,
        Consumer<RecordedEvent> eventAppeared,
        Runnable liveProcessingStarted,
        BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped,
        UserCredentials credentials
    ) {
        ensureConnected();
        validateStream(stream);
        CatchUpSubscriptionSettings effective = settings == null ? CatchUpSubscriptionSettings.DEFAULT : settings;
        StoreSubscription subscription = new StoreSubscription(
            stream, eventAppeared, liveProcessingStarted, subscriptionDropped, effective.maxLiveQueueSize()
        );

        boolean deleted;
        int replayed = 0;
        synchronized (lock) {
            StreamState state = streams.get(stream);
            deleted = state != null && state.hardDeleted;
            if (!deleted) {
                if (state != null && !state.softDeleted) {
                    long from = lastCheckpoint == null ? 0L : lastCheckpoint + 1;
                    for (long i = Math.max(from, state.truncateBefore); i < state.events.size(); i++) {
                        subscription.enqueueHistory(state.events.get((int) i));
                        replayed++;
                    }
                }
                subscription.enqueueLiveMarker();
                register(subscription);
            }
        }
        if (effective.verboseLogging()) {
            log.debug("Catch-up subscription '{}' on '{}' replaying {} events from checkpoint {}.",
                effective.subscriptionName(), stream, replayed, lastCheckpoint);
        }
        subscription.start(threadFactory);
        if (deleted) {
            subscription.drop(SubscriptionDropReason.STREAM_DELETED, null);
        }
        return subscription;
    }

    @Override
    public Subscription subscribeToAll(
        Consumer<RecordedEvent> eventAppeared,
        BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped,
        UserCredentials credentials
    ) {
        ensureConnected();
        StoreSubscription subscription = new StoreSubscription(
            null, eventAppeared, null, subscriptionDropped, CatchUpSubscriptionSettings.DEFAULT.maxLiveQueueSize()
        );
        synchronized (lock) {
            allSubscriptions.add(subscription);
        }
        subscription.start(threadFactory);
        return subscription;
    }

    private void register(StoreSubscription subscription) {
        streamSubscriptions.computeIfAbsent(subscription.stream, s -> new ArrayList<>()).add(subscription);
    }

    private void unregister(StoreSubscription subscription) {
        synchronized (lock) {
            if (subscription.stream == null) {
                allSubscriptions.remove(subscription);
                return;
            }
            List<StoreSubscription> subscriptions = streamSubscriptions.get(subscription.stream);
            if (subscriptions != null) {
                subscriptions.remove(subscription);
                if (subscriptions.isEmpty()) {
                    streamSubscriptions.remove(subscription.stream);
                }
            }
        }
    }

    private void ensureConnected() {
        if (!connected.get()) {
            throw new StreamStoreConnectionException("Not Connected");
        }
    }

    private static void validateStream(String stream) {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream cannot be null, empty or whitespace");
        }
    }

    @Override
    public String toString() {
        return "InMemoryStreamStoreConnection{name=" + connectionName + ", connected=" + connected.get() + "}";
    }

    // ========== Internal state ==========

    private static final class StreamState {
        private final List<RecordedEvent> events = new ArrayList<>();
        private long truncateBefore;
        private boolean softDeleted;
        private boolean hardDeleted;

        private long lastEventNumber() {
            return events.size() - 1L;
        }

        private boolean isDeleted() {
            return softDeleted || hardDeleted;
        }

        private RecordedEvent append(String stream, EventData data, Instant created) {
            RecordedEvent recorded = new RecordedEvent(
                stream, data.eventId(), events.size(), data.eventType(),
                data.data(), data.metadata(), data.isJson(), created
            );
            events.add(recorded);
            return recorded;
        }
    }

    private enum Marker {
        LIVE
    }

    private record LiveEvent(RecordedEvent event) {
    }

    private record Dropped(SubscriptionDropReason reason, Exception exception) {
    }

    private final class StoreSubscription implements Subscription {

        private final String stream;
        private final Consumer<RecordedEvent> eventAppeared;
        private final Runnable liveProcessingStarted;
        private final BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped;
        private final int maxLiveQueueSize;

        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
        private final AtomicInteger pendingLive = new AtomicInteger();
        private final AtomicBoolean dropped = new AtomicBoolean(false);
        private volatile Thread worker;

        private StoreSubscription(
            String stream,
            Consumer<RecordedEvent> eventAppeared,
            Runnable liveProcessingStarted,
            BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped,
            int maxLiveQueueSize
        ) {
            if (eventAppeared == null) {
                throw new IllegalArgumentException("eventAppeared cannot be null");
            }
            this.stream = stream;
            this.eventAppeared = eventAppeared;
            this.liveProcessingStarted = liveProcessingStarted;
            this.subscriptionDropped = subscriptionDropped;
            this.maxLiveQueueSize = maxLiveQueueSize;
        }

        private void start(DaemonThreadFactory factory) {
            Thread thread = factory.newThread(this::run);
            worker = thread;
            thread.start();
        }

        private void enqueueHistory(RecordedEvent event) {
            queue.add(event);
        }

        private void enqueueLiveMarker() {
            queue.add(Marker.LIVE);
        }

        private void enqueueLive(RecordedEvent event) {
            if (dropped.get()) {
                return;
            }
            if (pendingLive.incrementAndGet() > maxLiveQueueSize) {
                drop(SubscriptionDropReason.PROCESSING_QUEUE_OVERFLOW, null);
                return;
            }
            queue.add(new LiveEvent(event));
        }

        private void drop(SubscriptionDropReason reason, Exception exception) {
            if (!dropped.compareAndSet(false, true)) {
                return;
            }
            unregister(this);
            queue.clear();
            queue.add(new Dropped(reason, exception));
        }

        private void run() {
            try {
                while (true) {
                    Object item = queue.take();
                    if (item instanceof Dropped signal) {
                        notifyDropped(signal.reason(), signal.exception());
                        return;
                    }
                    if (dropped.get()) {
                        continue;
                    }
                    try {
                        dispatch(item);
                    } catch (RuntimeException e) {
                        log.error("Subscription handler on '{}' failed.", stream == null ? "$all" : stream, e);
                        drop(SubscriptionDropReason.EVENT_HANDLER_EXCEPTION, e);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void dispatch(Object item) {
            if (item == Marker.LIVE) {
                if (liveProcessingStarted != null) {
                    liveProcessingStarted.run();
                }
            } else if (item instanceof LiveEvent live) {
                pendingLive.decrementAndGet();
                eventAppeared.accept(live.event());
            } else {
                eventAppeared.accept((RecordedEvent) item);
            }
        }

        private void notifyDropped(SubscriptionDropReason reason, Exception exception) {
            log.debug("Subscription on '{}' dropped: {}.", stream == null ? "$all" : stream, reason);
            if (subscriptionDropped != null) {
                subscriptionDropped.accept(reason, exception);
            }
        }

        @Override
        public void close() {
            drop(SubscriptionDropReason.USER_INITIATED, null);
        }

        @Override
        public String toString() {
            return "StoreSubscription{stream=" + stream + ", worker=" + (worker == null ? null : worker.getName()) + "}";
        }
    }
}
