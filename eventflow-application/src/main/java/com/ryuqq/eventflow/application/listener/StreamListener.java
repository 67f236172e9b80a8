package com.ryuqq.eventflow.application.listener;

import com.ryuqq.eventflow.adapter.inmemory.bus.InMemoryBus;
import com.ryuqq.eventflow.core.message.CatchupSubscriptionBecameLive;
import com.ryuqq.eventflow.core.message.Event;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.model.CatchUpSubscriptionSettings;
import com.ryuqq.eventflow.core.model.RecordedEvent;
import com.ryuqq.eventflow.core.model.StreamNotFoundSlice;
import com.ryuqq.eventflow.core.model.SubscriptionDropReason;
import com.ryuqq.eventflow.core.spi.EventSerializer;
import com.ryuqq.eventflow.core.spi.EventSource;
import com.ryuqq.eventflow.core.spi.StreamNameBuilder;
import com.ryuqq.eventflow.core.spi.StreamStoreConnection;
import com.ryuqq.eventflow.core.spi.Subscriber;
import com.ryuqq.eventflow.core.spi.Subscription;
import com.ryuqq.eventflow.core.statemachine.ListenerState;
import com.ryuqq.eventflow.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 저장소 catch-up 구독을 감싸는 리스너.
 *
 * <p>받은 {@link RecordedEvent}를 직렬화기로 복원해 내부 {@link InMemoryBus}에 publish 합니다.
 * 구독 핸들러는 저장소 구독 스레드에서 호출됩니다. 핸들러 처리 시간이 들쭉날쭉하고 순서가 중요하면
 * {@link QueuedStreamListener}를 사용하세요.</p>
 *
 * <p><strong>시작 흐름:</strong></p>
 * <ol>
 *   <li>이미 시작했으면 {@link IllegalStateException}</li>
 *   <li>스트림 검증 (첫 이벤트 point read, 없으면 {@link IllegalArgumentException})</li>
 *   <li>{@code READING_HISTORY} 전이 후 checkpoint부터 catch-up 구독</li>
 *   <li>저장소가 live 전환을 알리면 {@link CatchupSubscriptionBecameLive} publish, {@code LIVE} 전이</li>
 *   <li>blockUntilLive면 live 전환까지 timeout 동안 대기</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamListener implements Listener {

    private static final Logger log = LoggerFactory.getLogger(StreamListener.class);

    private final String name;
    private final StreamStoreConnection connection;
    private final StreamNameBuilder streamNameBuilder;
    private final EventSerializer serializer;
    private final InMemoryBus bus;

    private final Object startLock = new Object();
    private final CountDownLatch liveLatch = new CountDownLatch(1);
    private final AtomicReference<ListenerState> state = new AtomicReference<>(ListenerState.NOT_STARTED);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile CatchUpSubscriptionSettings settings = CatchUpSubscriptionSettings.DEFAULT;
    private volatile boolean validateStream = true;
    private volatile Subscription subscription;
    private volatile String streamName;
    private volatile long position = -1;

    public StreamListener(
        String name,
        StreamStoreConnection connection,
        StreamNameBuilder streamNameBuilder,
        EventSerializer serializer
    ) {
        this(name, connection, streamNameBuilder, serializer, null);
    }

    /**
     * 생성자.
     *
     * @param name 리스너 이름 (로그, 구독 이름)
     * @param connection 구독할 저장소
     * @param streamNameBuilder Aggregate/이벤트 타입 기반 스트림 이름 규칙
     * @param serializer 이벤트 복원용 직렬화기
     * @param busName 내부 버스 이름 (null이면 리스너 이름 사용)
     * @throws IllegalArgumentException 필수 인자가 null인 경우
     */
    public StreamListener(
        String name,
        StreamStoreConnection connection,
        StreamNameBuilder streamNameBuilder,
        EventSerializer serializer,
        String busName
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (streamNameBuilder == null) {
            throw new IllegalArgumentException("streamNameBuilder cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        this.name = name;
        this.connection = connection;
        this.streamNameBuilder = streamNameBuilder;
        this.serializer = serializer;
        this.bus = new InMemoryBus(busName != null ? busName : name + "-bus");
    }

    public String getName() {
        return name;
    }

    @Override
    public Subscriber eventStream() {
        return bus;
    }

    @Override
    public long getPosition() {
        return position;
    }

    @Override
    public String getStreamName() {
        return streamName;
    }

    @Override
    public boolean isLive() {
        return state.get() == ListenerState.LIVE;
    }

    @Override
    public ListenerState getState() {
        return state.get();
    }

    public CatchUpSubscriptionSettings getSettings() {
        return settings;
    }

    public void setSettings(CatchUpSubscriptionSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
    }

    /**
     * false로 두면 아직 없는 스트림도 구독합니다 (첫 append부터 live로 받음).
     */
    public void setValidateStream(boolean validateStream) {
        this.validateStream = validateStream;
    }

    @Override
    public void startForAggregate(
        Class<? extends EventSource> aggregateType,
        UUID id,
        Long checkpoint,
        boolean blockUntilLive,
        Duration timeout
    ) {
        start(streamNameBuilder.generateForAggregate(aggregateType, id), checkpoint, blockUntilLive, timeout);
    }

    @Override
    public void startForCategory(
        Class<? extends EventSource> aggregateType,
        Long checkpoint,
        boolean blockUntilLive,
        Duration timeout
    ) {
        start(streamNameBuilder.generateForCategory(aggregateType), checkpoint, blockUntilLive, timeout);
    }

    @Override
    public void startForEventType(Class<?> eventType, Long checkpoint, boolean blockUntilLive, Duration timeout) {
        requireEventType(eventType);
        start(streamNameBuilder.generateForEventType(eventType.getSimpleName()), checkpoint, blockUntilLive, timeout);
    }

    @Override
    public void start(String streamName, Long checkpoint, boolean blockUntilLive, Duration timeout) {
        if (streamName == null || streamName.isBlank()) {
            throw new IllegalArgumentException("streamName cannot be null or blank");
        }
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        synchronized (startLock) {
            if (state.get() != ListenerState.NOT_STARTED) {
                throw new IllegalStateException("Listener already started.");
            }
            if (validateStream && !validateStreamName(streamName)) {
                throw new IllegalArgumentException("Stream not found.");
            }
            this.streamName = streamName;
            this.position = checkpoint == null ? -1 : checkpoint;
            transition(ListenerState.NOT_STARTED, ListenerState.READING_HISTORY);
            beforeSubscribe();
            try {
                subscription = connection.subscribeToStreamFrom(
                    streamName,
                    checkpoint,
                    settings.withSubscriptionName(name),
                    this::gotEvent,
                    this::liveProcessingStarted,
                    this::subscriptionDropped,
                    null
                );
            } catch (RuntimeException e) {
                state.set(ListenerState.STOPPED);
                throw e;
            }
            log.debug("Listener '{}' started on '{}' from checkpoint {}.", name, streamName, checkpoint);
        }
        if (blockUntilLive) {
            awaitLive(timeout);
        }
    }

    /**
     * live 전환을 기다립니다.
     *
     * @return 제한 시간 안에 live가 되면 true
     */
    public boolean awaitLive(Duration timeout) {
        try {
            boolean live = liveLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!live) {
                log.debug("Listener '{}' on '{}' did not become live within {}ms.", name, streamName, timeout.toMillis());
            }
            return live;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 첫 이벤트 point read로 스트림 존재 여부를 확인합니다.
     */
    public boolean validateStreamName(String streamName) {
        return !(connection.readStreamForward(streamName, 0, 1) instanceof StreamNotFoundSlice);
    }

    /**
     * 구독 직전 호출됩니다.
     */
    protected void beforeSubscribe() {
    }

    protected void gotEvent(RecordedEvent recordedEvent) {
        if (closed.get()) {
            return;
        }
        position = recordedEvent.eventNumber();
        Object event = serializer.deserialize(recordedEvent);
        if (event instanceof Message message) {
            deliver(message);
        }
    }

    /**
     * 복원한 메시지를 구독자에게 전달합니다.
     */
    protected void deliver(Message message) {
        bus.publish(message);
    }

    /**
     * 저장소가 이력 재생을 마쳤을 때 호출됩니다.
     */
    protected void liveProcessingStarted() {
        becomeLive();
    }

    /**
     * {@code LIVE}로 전이하고 live 마커를 한 번만 publish 합니다.
     */
    protected final void becomeLive() {
        if (!transition(ListenerState.READING_HISTORY, ListenerState.LIVE)) {
            return;
        }
        bus.publish(new CatchupSubscriptionBecameLive());
        liveLatch.countDown();
        log.debug("Listener '{}' on '{}' is live at position {}.", name, streamName, position);
    }

    private void subscriptionDropped(SubscriptionDropReason reason, Exception exception) {
        if (reason == SubscriptionDropReason.USER_INITIATED) {
            log.debug("Listener '{}' subscription on '{}' closed.", name, streamName);
        } else {
            log.warn("Listener '{}' subscription on '{}' dropped: {}.", name, streamName, reason, exception);
        }
        state.set(ListenerState.STOPPED);
    }

    private boolean transition(ListenerState from, ListenerState to) {
        return StateTransition.isAllowed(from, to) && state.compareAndSet(from, to);
    }

    protected boolean isClosed() {
        return closed.get();
    }

    static void requireEventType(Class<?> eventType) {
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (!Event.class.isAssignableFrom(eventType) || Event.class.equals(eventType)) {
            throw new IllegalArgumentException("type must derive from " + Event.class.getName());
        }
    }

    /**
     * 구독 해제 후 {@link #onClose()}, 내부 버스 순으로 닫습니다.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        state.set(ListenerState.STOPPED);
        try {
            Subscription current = subscription;
            if (current != null) {
                current.close();
            }
        } finally {
            try {
                onClose();
            } finally {
                bus.close();
            }
        }
    }

    /**
     * 하위 클래스 자원 정리.
     */
    protected void onClose() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", stream=" + streamName + ", state=" + state.get() + "}";
    }
}
