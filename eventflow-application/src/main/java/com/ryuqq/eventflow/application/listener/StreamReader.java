package com.ryuqq.eventflow.application.listener;

import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.model.RecordedEvent;
import com.ryuqq.eventflow.core.model.StreamDeletedSlice;
import com.ryuqq.eventflow.core.model.StreamEventsSlice;
import com.ryuqq.eventflow.core.model.StreamNotFoundSlice;
import com.ryuqq.eventflow.core.spi.EventSerializer;
import com.ryuqq.eventflow.core.spi.EventSource;
import com.ryuqq.eventflow.core.spi.StreamNameBuilder;
import com.ryuqq.eventflow.core.spi.StreamStoreConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 스트림을 한 번 페이지 단위로 읽어 핸들러에 넘기는 리더.
 *
 * <p><strong>읽기 규칙:</strong></p>
 * <ul>
 *   <li>페이지 크기 {@value #READ_PAGE_SIZE}</li>
 *   <li>checkpoint가 없으면 앞으로 읽을 때 0, 뒤로 읽을 때 끝(-1)부터 시작</li>
 *   <li>checkpoint가 있으면 그 다음(뒤로 읽으면 그 이전) 이벤트부터 시작</li>
 *   <li>스트림 끝, {@link #cancel()}, 또는 count만큼 읽으면 종료</li>
 *   <li>하나라도 읽었으면 completionCheck가 true가 될 때까지 대기 (check 예외는 true로 간주)</li>
 * </ul>
 *
 * <p>인스턴스는 한 번에 하나의 읽기만 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamReader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamReader.class);

    public static final int READ_PAGE_SIZE = 500;

    private final String name;
    private final StreamStoreConnection connection;
    private final StreamNameBuilder streamNameBuilder;
    private final EventSerializer serializer;

    private volatile Consumer<Message> handler;
    private volatile boolean cancelled;
    private volatile boolean firstEventRead;
    private volatile long position;
    private volatile String streamName;

    /**
     * 생성자.
     *
     * @param name 리더 이름 (null이면 "stream-reader")
     * @param handler 읽은 메시지를 받을 핸들러 (나중에 {@link #setHandler}로 지정 가능)
     * @throws IllegalArgumentException connection, streamNameBuilder, serializer가 null인 경우
     */
    public StreamReader(
        String name,
        StreamStoreConnection connection,
        StreamNameBuilder streamNameBuilder,
        EventSerializer serializer,
        Consumer<Message> handler
    ) {
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (streamNameBuilder == null) {
            throw new IllegalArgumentException("streamNameBuilder cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        this.name = name != null ? name : "stream-reader";
        this.connection = connection;
        this.streamNameBuilder = streamNameBuilder;
        this.serializer = serializer;
        this.handler = handler;
    }

    public String getName() {
        return name;
    }

    /**
     * @return 마지막으로 읽은 이벤트 번호, 아무것도 읽지 않았으면 null
     */
    public Long getPosition() {
        return firstEventRead ? position : null;
    }

    public String getStreamName() {
        return streamName;
    }

    public void setHandler(Consumer<Message> handler) {
        this.handler = handler;
    }

    public boolean readForEventType(
        Class<?> eventType,
        BooleanSupplier completionCheck,
        Long checkpoint,
        Long count,
        boolean readBackwards
    ) {
        StreamListener.requireEventType(eventType);
        return read(
            streamNameBuilder.generateForEventType(eventType.getSimpleName()),
            completionCheck, checkpoint, count, readBackwards);
    }

    public boolean readForCategory(
        Class<? extends EventSource> aggregateType,
        BooleanSupplier completionCheck,
        Long checkpoint,
        Long count,
        boolean readBackwards
    ) {
        return read(streamNameBuilder.generateForCategory(aggregateType), completionCheck, checkpoint, count, readBackwards);
    }

    public boolean readForAggregate(
        Class<? extends EventSource> aggregateType,
        UUID id,
        BooleanSupplier completionCheck,
        Long checkpoint,
        Long count,
        boolean readBackwards
    ) {
        return read(
            streamNameBuilder.generateForAggregate(aggregateType, id),
            completionCheck, checkpoint, count, readBackwards);
    }

    public boolean read(String streamName, BooleanSupplier completionCheck) {
        return read(streamName, completionCheck, null, null, false);
    }

    /**
     * 스트림을 읽습니다.
     *
     * @param streamName 정확한 스트림 이름
     * @param completionCheck 읽은 뒤 true가 될 때까지 대기할 조건 (null이면 대기 없음)
     * @param checkpoint 마지막으로 처리한 이벤트 번호 (null이면 처음 또는 끝부터)
     * @param count 최대 읽을 개수 (null이면 제한 없음)
     * @param readBackwards 끝에서 처음 방향으로 읽기
     * @return 하나 이상 읽었으면 true, 스트림이 없거나 삭제됐으면 false
     * @throws IllegalArgumentException checkpoint가 음수이거나 count가 0 이하인 경우
     */
    public boolean read(
        String streamName,
        BooleanSupplier completionCheck,
        Long checkpoint,
        Long count,
        boolean readBackwards
    ) {
        if (checkpoint != null && checkpoint < 0) {
            throw new IllegalArgumentException("checkpoint must not be negative (current: " + checkpoint + ")");
        }
        if (count != null && count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
        if (!validateStreamName(streamName)) {
            return false;
        }
        cancelled = false;
        firstEventRead = false;
        this.streamName = streamName;

        long sliceStart;
        if (checkpoint == null) {
            sliceStart = readBackwards ? -1 : 0;
        } else {
            sliceStart = checkpoint + (readBackwards ? -1 : 1);
        }
        long remaining = count != null ? count : Long.MAX_VALUE;
        // 뒤로 읽을 때 checkpoint 0 이전에는 이벤트가 없다
        boolean nothingToRead = readBackwards && checkpoint != null && sliceStart < 0;
        StreamEventsSlice slice;
        do {
            if (nothingToRead) {
                break;
            }
            long page = Math.min(remaining, READ_PAGE_SIZE);
            slice = readBackwards
                ? connection.readStreamBackward(streamName, sliceStart, page)
                : connection.readStreamForward(streamName, sliceStart, page);
            if (slice instanceof StreamNotFoundSlice || slice instanceof StreamDeletedSlice) {
                break;
            }
            remaining -= slice.getEvents().size();
            sliceStart = slice.getNextEventNumber();
            for (RecordedEvent event : slice.getEvents()) {
                eventRead(event);
            }
        } while (!slice.isEndOfStream() && !cancelled && remaining != 0);

        if (firstEventRead && completionCheck != null) {
            awaitCompletion(completionCheck);
        }
        log.debug("Reader '{}' finished '{}' at position {}.", name, streamName, getPosition());
        return firstEventRead;
    }

    /**
     * 스트림이 존재하고 삭제되지 않았으면 true.
     *
     * @throws com.ryuqq.eventflow.core.exception.StreamStoreConnectionException 연결이 닫혀 있는 경우
     */
    public boolean validateStreamName(String streamName) {
        if (streamName == null || streamName.isBlank()) {
            return false;
        }
        StreamEventsSlice slice = connection.readStreamForward(streamName, 0, 1);
        return !(slice instanceof StreamNotFoundSlice) && !(slice instanceof StreamDeletedSlice);
    }

    protected void eventRead(RecordedEvent recordedEvent) {
        if (cancelled) {
            return;
        }
        position = recordedEvent.eventNumber();
        firstEventRead = true;
        Object event = serializer.deserialize(recordedEvent);
        Consumer<Message> current = handler;
        if (event instanceof Message message && current != null) {
            current.accept(message);
        }
    }

    private static void awaitCompletion(BooleanSupplier completionCheck) {
        while (!checkCompleted(completionCheck)) {
            Thread.yield();
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
        }
    }

    private static boolean checkCompleted(BooleanSupplier completionCheck) {
        try {
            return completionCheck.getAsBoolean();
        } catch (RuntimeException e) {
            log.debug("Completion check failed, treating the read as complete: {}", e.getMessage());
            return true;
        }
    }

    /**
     * 진행 중인 읽기를 페이지 사이에서 멈춥니다. 이미 읽은 페이지의 남은 이벤트도 전달하지 않습니다.
     */
    public void cancel() {
        cancelled = true;
    }

    @Override
    public void close() {
        cancel();
    }
}
