package com.ryuqq.eventflow.application.repository;

import com.ryuqq.eventflow.core.exception.AggregateDeletedException;
import com.ryuqq.eventflow.core.exception.AggregateNotFoundException;
import com.ryuqq.eventflow.core.exception.AggregateVersionException;
import com.ryuqq.eventflow.core.model.EventData;
import com.ryuqq.eventflow.core.model.RecordedEvent;
import com.ryuqq.eventflow.core.model.StreamDeletedSlice;
import com.ryuqq.eventflow.core.model.StreamEventsSlice;
import com.ryuqq.eventflow.core.model.StreamNotFoundSlice;
import com.ryuqq.eventflow.core.spi.EventSerializer;
import com.ryuqq.eventflow.core.spi.EventSource;
import com.ryuqq.eventflow.core.spi.Repository;
import com.ryuqq.eventflow.core.spi.StreamNameBuilder;
import com.ryuqq.eventflow.core.spi.StreamStoreConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 스트림 저장소 기반 {@link Repository} 구현체.
 *
 * <p><strong>로드 ({@link #getById(UUID, long, Supplier)}):</strong></p>
 * <ol>
 *   <li>타입과 id로 스트림 이름 생성</li>
 *   <li>factory로 빈 Aggregate 생성</li>
 *   <li>{@value #READ_PAGE_SIZE}개 단위로 앞에서부터 읽으며 이벤트 적용</li>
 *   <li>요청 버전에 도달하거나 스트림 끝이면 종료</li>
 *   <li>요청 버전이 LATEST가 아니면 적용 이벤트 수와 ExpectedVersion을 검증</li>
 * </ol>
 *
 * <p><strong>저장 ({@link #save(EventSource)}):</strong> 커밋 헤더(CommitId, Aggregate 타입명)를
 * 각 이벤트 헤더에 병합해 직렬화한 뒤, Aggregate의 ExpectedVersion으로 한 번에 append 합니다.
 * 버전 충돌은 재시도하지 않고 그대로 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StreamStoreRepository implements Repository {

    private static final Logger log = LoggerFactory.getLogger(StreamStoreRepository.class);

    public static final String AGGREGATE_CLR_TYPE_HEADER = "AggregateClrTypeName";
    public static final String AGGREGATE_CLR_TYPE_NAME_HEADER = "AggregateClrTypeNameHeader";
    public static final String COMMIT_ID_HEADER = "CommitId";
    public static final int READ_PAGE_SIZE = 500;

    private final StreamNameBuilder streamNameBuilder;
    private final StreamStoreConnection connection;
    private final EventSerializer serializer;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StreamStoreRepository(
        StreamNameBuilder streamNameBuilder,
        StreamStoreConnection connection,
        EventSerializer serializer
    ) {
        if (streamNameBuilder == null) {
            throw new IllegalArgumentException("streamNameBuilder cannot be null");
        }
        if (connection == null) {
            throw new IllegalArgumentException("connection cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        this.streamNameBuilder = streamNameBuilder;
        this.connection = connection;
        this.serializer = serializer;
    }

    @Override
    public <T extends EventSource> T getById(UUID id, long version, Supplier<T> factory) {
        if (version <= 0) {
            throw new IllegalStateException("Cannot get version <= 0");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        T aggregate = factory.get();
        Class<?> type = aggregate.getClass();
        String streamName = streamNameBuilder.generateForAggregate(type, id);

        long sliceStart = 0;
        long appliedEventCount = 0;
        StreamEventsSlice slice;
        do {
            long sliceCount = sliceStart + READ_PAGE_SIZE <= version ? READ_PAGE_SIZE : version - sliceStart;
            slice = readPage(streamName, sliceStart, sliceCount, id, type);
            sliceStart = slice.getNextEventNumber();
            appliedEventCount += slice.getEvents().size();
            aggregate.restoreFromEvents(deserialize(slice.getEvents()));
        } while (version > slice.getNextEventNumber() && !slice.isEndOfStream());

        if (version != LATEST && version != appliedEventCount) {
            throw new AggregateVersionException(id, type, version, aggregate.getExpectedVersion());
        }
        if (version != LATEST && aggregate.getExpectedVersion() != version - 1) {
            throw new AggregateVersionException(id, type, version, aggregate.getExpectedVersion());
        }
        return aggregate;
    }

    @Override
    public <T extends EventSource> Optional<T> tryGetById(UUID id, long version, Supplier<T> factory) {
        try {
            return Optional.of(getById(id, version, factory));
        } catch (RuntimeException e) {
            log.debug("Unable to load aggregate {} at version {}: {}", id, version, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 현재 버전 이후의 이벤트를 읽어 Aggregate에 바로 적용합니다.
     *
     * @throws IllegalStateException version이 0 이하이거나 현재 버전보다 낮은 경우
     */
    @Override
    public void update(EventSource aggregate, long version) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        if (version <= 0) {
            throw new IllegalStateException("Cannot get version <= 0");
        }
        long currentVersion = aggregate.getExpectedVersion();
        if (version != LATEST && version - 1 < currentVersion) {
            throw new IllegalStateException(
                "Cannot update aggregate to version " + version + " below its current version " + currentVersion);
        }
        UUID id = aggregate.getId();
        Class<?> type = aggregate.getClass();
        String streamName = streamNameBuilder.generateForAggregate(type, id);

        List<Object> events = new ArrayList<>();
        long sliceStart = currentVersion + 1;
        StreamEventsSlice slice;
        do {
            long sliceCount = sliceStart + READ_PAGE_SIZE <= version ? READ_PAGE_SIZE : version - sliceStart;
            if (sliceCount <= 0) {
                break;
            }
            slice = readPage(streamName, sliceStart, sliceCount, id, type);
            sliceStart = slice.getNextEventNumber();
            events.addAll(deserialize(slice.getEvents()));
            if (slice.isEndOfStream()) {
                break;
            }
        } while (version > sliceStart);

        if (!events.isEmpty()) {
            aggregate.updateWithEvents(events, currentVersion);
        }
        if (version != LATEST && aggregate.getExpectedVersion() != version - 1) {
            throw new AggregateVersionException(id, type, version, aggregate.getExpectedVersion());
        }
    }

    @Override
    public void save(EventSource aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        Map<String, Object> commitHeaders = new HashMap<>();
        commitHeaders.put(COMMIT_ID_HEADER, UUID.randomUUID());
        commitHeaders.put(AGGREGATE_CLR_TYPE_NAME_HEADER, aggregate.getClass().getName());
        commitHeaders.put(AGGREGATE_CLR_TYPE_HEADER, aggregate.getClass().getSimpleName());

        String streamName = streamNameBuilder.generateForAggregate(aggregate.getClass(), aggregate.getId());
        // takeEvents 이전의 ExpectedVersion이 append 기준 버전
        long expectedVersion = aggregate.getExpectedVersion();
        List<Object> newEvents = aggregate.takeEvents();
        EventData[] eventsToSave = new EventData[newEvents.size()];
        for (int i = 0; i < newEvents.size(); i++) {
            eventsToSave[i] = serializer.serialize(newEvents.get(i), new HashMap<>(commitHeaders));
        }
        connection.appendToStream(streamName, expectedVersion, eventsToSave);
    }

    @Override
    public void delete(EventSource aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        String streamName = streamNameBuilder.generateForAggregate(aggregate.getClass(), aggregate.getId());
        connection.deleteStream(streamName, aggregate.getExpectedVersion());
    }

    @Override
    public void hardDelete(EventSource aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        String streamName = streamNameBuilder.generateForAggregate(aggregate.getClass(), aggregate.getId());
        connection.hardDeleteStream(streamName, aggregate.getExpectedVersion());
    }

    private StreamEventsSlice readPage(String streamName, long start, long count, UUID id, Class<?> type) {
        StreamEventsSlice slice = connection.readStreamForward(streamName, start, count);
        if (slice instanceof StreamNotFoundSlice) {
            throw new AggregateNotFoundException(id, type);
        }
        if (slice instanceof StreamDeletedSlice) {
            throw new AggregateDeletedException(id, type);
        }
        return slice;
    }

    private List<Object> deserialize(List<RecordedEvent> recorded) {
        List<Object> events = new ArrayList<>(recorded.size());
        for (RecordedEvent event : recorded) {
            events.add(serializer.deserialize(event));
        }
        return events;
    }
}
