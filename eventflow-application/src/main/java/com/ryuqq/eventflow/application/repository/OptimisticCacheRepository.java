package com.ryuqq.eventflow.application.repository;

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
 * 저장에 성공한 Aggregate만 캐시하는 Repository 래퍼.
 *
 * <p>조회는 캐시에 있으면 저장소를 보지 않고 캐시 인스턴스를 그대로 돌려줍니다.
 * 저장에 실패하면 항목을 제거하므로 다음 조회는 저장소에서 다시 로드합니다.</p>
 *
 * <p><strong>주의:</strong> Aggregate 인스턴스당 단일 writer를 전제합니다.
 * 같은 id를 여러 스레드가 동시에 저장하는 경우는 외부에서 조율해야 합니다.</p>
 *
 * <p>항목은 (타입, id)로 구분하므로 타입이 다른 Aggregate가 같은 id를 써도 섞이지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class OptimisticCacheRepository {

    private static final Logger log = LoggerFactory.getLogger(OptimisticCacheRepository.class);

    private final Repository repository;
    private final Map<AggregateKey, EventSource> cache = new ConcurrentHashMap<>();

    public OptimisticCacheRepository(Repository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        this.repository = repository;
    }

    /**
     * @throws com.ryuqq.eventflow.core.exception.AggregateException 캐시에 없고 로드에 실패한 경우
     */
    @SuppressWarnings("unchecked")
    public <T extends EventSource> T getById(UUID id, Supplier<T> factory) {
        EventSource cached = cache.get(AggregateKey.of(id, factory));
        if (cached != null) {
            return (T) cached;
        }
        return repository.getById(id, factory);
    }

    @SuppressWarnings("unchecked")
    public <T extends EventSource> Optional<T> tryGetById(UUID id, Supplier<T> factory) {
        if (id == null || factory == null) {
            return Optional.empty();
        }
        EventSource cached = cache.get(AggregateKey.of(id, factory));
        if (cached != null) {
            return Optional.of((T) cached);
        }
        return repository.tryGetById(id, factory);
    }

    /**
     * 저장하고 성공하면 캐시합니다.
     *
     * @throws RuntimeException 저장 실패 (항목은 제거됨)
     */
    public void save(EventSource aggregate) {
        RuntimeException failure = trySave(aggregate);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * @return 실패 원인, 성공하면 null
     */
    public RuntimeException trySave(EventSource aggregate) {
        if (aggregate == null) {
            throw new IllegalArgumentException("aggregate cannot be null");
        }
        try {
            repository.save(aggregate);
            cache.put(AggregateKey.of(aggregate), aggregate);
            return null;
        } catch (RuntimeException e) {
            log.debug("Save of aggregate {} failed, evicting: {}", aggregate.getId(), e.getMessage());
            cache.remove(AggregateKey.of(aggregate));
            return e;
        }
    }

    /**
     * @return 어느 타입으로든 해당 id가 캐시되어 있으면 true
     */
    public boolean isCached(UUID id) {
        return cache.keySet().stream().anyMatch(key -> key.id().equals(id));
    }

    public boolean isCached(UUID id, Class<? extends EventSource> type) {
        return cache.containsKey(new AggregateKey(type, id));
    }

    /**
     * 해당 id의 모든 타입 항목을 제거합니다.
     */
    public void clearCache(UUID id) {
        cache.keySet().removeIf(key -> key.id().equals(id));
    }

    public void clearCache() {
        cache.clear();
    }
}
