package com.ryuqq.eventflow.application.listener;

import com.ryuqq.eventflow.adapter.runner.QueuedSubscriber;
import com.ryuqq.eventflow.core.message.CatchupSubscriptionBecameLive;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.EventSerializer;
import com.ryuqq.eventflow.core.spi.EventSource;
import com.ryuqq.eventflow.core.spi.Handler;
import com.ryuqq.eventflow.core.spi.StreamNameBuilder;
import com.ryuqq.eventflow.core.spi.StreamStoreConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 스트림 이벤트로 상태를 조립하는 read model 베이스.
 *
 * <p>하위 클래스는 생성자에서 {@link #subscribe(Class, Handler)}로 이벤트 핸들러를 등록합니다.
 * 모든 핸들러는 내부 큐의 소비 스레드 하나에서 순서대로 호출되므로 상태에 잠금이 필요 없습니다.</p>
 *
 * <p><strong>시작 흐름 ({@link #start(String, Long, boolean, Duration)}):</strong></p>
 * <ol>
 *   <li>reader가 있으면 이력을 큐로 읽고, 큐가 모두 처리될 때까지 호출 스레드 대기</li>
 *   <li>reader가 마지막으로 읽은 위치를 checkpoint로 사용</li>
 *   <li>새 listener를 만들어 그 checkpoint부터 live 구독</li>
 * </ol>
 *
 * <p>{@link #getVersion()}은 핸들러 유무와 관계없이 처리한 메시지마다 1씩 증가합니다.
 * live 전환 마커는 read model로 전달하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class ReadModelBase extends QueuedSubscriber {

    private static final Logger log = LoggerFactory.getLogger(ReadModelBase.class);

    private final String name;
    private final Supplier<Listener> listenerFactory;
    private final Supplier<StreamReader> readerFactory;
    private final List<Listener> listeners = new ArrayList<>();
    private final AtomicLong version = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Handler<Message> forwarder = this::forward;

    /**
     * {@link QueuedStreamListener}와 {@link StreamReader}를 쓰는 read model.
     */
    protected ReadModelBase(
        String name,
        StreamStoreConnection connection,
        StreamNameBuilder streamNameBuilder,
        EventSerializer serializer
    ) {
        this(
            name,
            () -> new QueuedStreamListener(name, connection, streamNameBuilder, serializer),
            () -> new StreamReader(name, connection, streamNameBuilder, serializer, null)
        );
    }

    /**
     * @param name read model 이름 (내부 큐 이름)
     * @param listenerFactory start 마다 새 listener를 만드는 함수
     * @param readerFactory 이력 reader를 만드는 함수 (null이면 listener만으로 재생)
     * @throws IllegalArgumentException listenerFactory가 null인 경우
     */
    protected ReadModelBase(String name, Supplier<Listener> listenerFactory, Supplier<StreamReader> readerFactory) {
        super(name);
        if (listenerFactory == null) {
            throw new IllegalArgumentException("listenerFactory cannot be null");
        }
        this.name = name;
        this.listenerFactory = listenerFactory;
        this.readerFactory = readerFactory;
    }

    public String getName() {
        return name;
    }

    /**
     * @return 지금까지 처리한 메시지 수
     */
    public long getVersion() {
        return version.get();
    }

    @Override
    protected void dispatch(Message message) {
        try {
            super.dispatch(message);
        } finally {
            version.incrementAndGet();
        }
    }

    private void forward(Message message) {
        if (message instanceof CatchupSubscriptionBecameLive) {
            return;
        }
        handle(message);
    }

    public void start(String streamName) {
        start(streamName, null, false, Listener.DEFAULT_LIVE_TIMEOUT);
    }

    /**
     * 이름으로 지정한 스트림을 재생하고 구독합니다.
     *
     * @param streamName 스트림 이름
     * @param checkpoint 마지막으로 처리한 이벤트 번호 (null이면 처음부터)
     * @param blockUntilLive listener가 live가 될 때까지 대기
     * @param timeout live 대기 시간
     */
    public void start(String streamName, Long checkpoint, boolean blockUntilLive, Duration timeout) {
        Long effective = readHistory(reader -> reader.read(streamName, this::isIdle, checkpoint, null, false), checkpoint);
        addNewListener().start(streamName, effective, blockUntilLive, timeout);
    }

    public void startForAggregate(
        Class<? extends EventSource> aggregateType,
        UUID id,
        Long checkpoint,
        boolean blockUntilLive,
        Duration timeout
    ) {
        Long effective = readHistory(
            reader -> reader.readForAggregate(aggregateType, id, this::isIdle, checkpoint, null, false), checkpoint);
        addNewListener().startForAggregate(aggregateType, id, effective, blockUntilLive, timeout);
    }

    public void startForCategory(
        Class<? extends EventSource> aggregateType,
        Long checkpoint,
        boolean blockUntilLive,
        Duration timeout
    ) {
        Long effective = readHistory(
            reader -> reader.readForCategory(aggregateType, this::isIdle, checkpoint, null, false), checkpoint);
        addNewListener().startForCategory(aggregateType, effective, blockUntilLive, timeout);
    }

    private Long readHistory(Function<StreamReader, Boolean> read, Long checkpoint) {
        if (closed.get()) {
            throw new IllegalStateException("Read model '" + name + "' is closed.");
        }
        if (readerFactory == null) {
            return checkpoint;
        }
        try (StreamReader reader = readerFactory.get()) {
            reader.setHandler(this::handle);
            Long effective = checkpoint;
            if (read.apply(reader)) {
                effective = reader.getPosition();
            }
            reader.setHandler(null);
            log.debug("Read model '{}' caught up '{}' to {}.", name, reader.getStreamName(), effective);
            return effective;
        }
    }

    private Listener addNewListener() {
        Listener listener = listenerFactory.get();
        synchronized (listeners) {
            listeners.add(listener);
        }
        listener.eventStream().subscribeToAll(forwarder);
        return listener;
    }

    /**
     * @return 활성 listener마다의 (스트림 이름, 위치)
     */
    public List<StreamCheckpoint> getCheckpoint() {
        synchronized (listeners) {
            List<StreamCheckpoint> checkpoints = new ArrayList<>(listeners.size());
            for (Listener listener : listeners) {
                checkpoints.add(new StreamCheckpoint(listener.getStreamName(), listener.getPosition()));
            }
            return checkpoints;
        }
    }

    /**
     * listener를 모두 닫고 내부 큐를 멈춥니다.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            synchronized (listeners) {
                for (Listener listener : listeners) {
                    listener.close();
                }
                listeners.clear();
            }
        } finally {
            super.close();
        }
    }
}
