package com.ryuqq.eventflow.application.repository;

import com.ryuqq.eventflow.core.exception.AggregateVersionException;
import com.ryuqq.eventflow.core.spi.AggregateCache;
import com.ryuqq.eventflow.core.spi.EventSource;
import com.ryuqq.eventflow.core.spi.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 읽을 때마다 저장소와 맞추는 Aggregate 캐시.
 *
 * <p><strong>조회:</strong></p>
 * <ul>
 *   <li>캐시 hit: {@link Repository#updateToCurrent}로 이후 이벤트를 적용한 뒤 반환</li>
 *   <li>캐시 miss: {@link Repository#getById}로 로드 후 저장</li>
 *   <li>갱신 실패: 항목을 제거하고 empty 반환</li>
 * </ul>
 *
 * <p><strong>저장:</strong> 성공하면 캐시에 넣고, 실패하면 항목을 제거한 뒤 false를 반환합니다.</p>
 *
 * <p>항목은 (타입, id)로 구분합니다. {@link #remove(UUID)}는 해당 id의 모든 타입 항목을 제거합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ReadThroughAggregateCache implements AggregateCache {

    private static final Logger log = LoggerFactory.getLogger(ReadThroughAggregateCache.class);

    private final Repository repository;
    private final Map<AggregateKey, EventSource> knownAggregates = new ConcurrentHashMap<>();

    public ReadThroughAggregateCache(Repository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        this.repository = repository;
    }

    @Override
    public <T extends EventSource> Optional<T> getById(UUID id, Supplier<T> factory) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        try {
            return Optional.of(load(id, factory));
        } catch (RuntimeException e) {
            log.debug("Aggregate {} could not be read through the cache: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends EventSource> T load(UUID id, Supplier<T> factory) {
        AggregateKey key = AggregateKey.of(id, factory);
        EventSource cached = knownAggregates.get(key);
        if (cached != null) {
            try {
                repository.updateToCurrent(cached);
                return (T) cached;
            } catch (AggregateVersionException e) {
                knownAggregates.remove(key);
                throw new IllegalStateException("Persisted version mismatch.", e);
            } catch (IllegalStateException e) {
                knownAggregates.remove(key);
                throw new IllegalStateException("Persisted version changed with recorded events in aggregate.", e);
            } catch (RuntimeException e) {
                knownAggregates.remove(key);
                throw e;
            }
        }
        T aggregate = repository.getById(id, factory);
        knownAggregates.put(key, aggregate);
        return aggregate;
    }

    @Override
    public boolean save(EventSource aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        try {
            repository.save(aggregate);
            knownAggregates.put(AggregateKey.of(aggregate), aggregate);
            return true;
        } catch (RuntimeException e) {
            log.debug("Save of aggregate {} failed, evicting: {}", aggregate.getId(), e.getMessage());
            knownAggregates.remove(AggregateKey.of(aggregate));
            return false;
        }
    }

    @Override
    public boolean remove(UUID id) {
        return knownAggregates.keySet().removeIf(key -> key.id().equals(id));
    }

    @Override
    public void clear() {
        knownAggregates.clear();
    }

    public int size() {
        return knownAggregates.size();
    }

    @Override
    public void close() {
        clear();
    }
}
