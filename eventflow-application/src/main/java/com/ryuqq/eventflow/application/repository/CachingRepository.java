package com.ryuqq.eventflow.application.repository;

import com.ryuqq.eventflow.core.exception.AggregateNotFoundException;
import com.ryuqq.eventflow.core.spi.AggregateCache;
import com.ryuqq.eventflow.core.spi.EventSource;
import com.ryuqq.eventflow.core.spi.Repository;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link AggregateCache} 전략을 주입받는 캐싱 파사드.
 *
 * <p>기본 전략은 {@link ReadThroughAggregateCache}입니다. 만료 정책은 없으며
 * {@link #clearCache(UUID)}, {@link #clearCache()}로 호출자가 직접 제거합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CachingRepository implements AutoCloseable {

    private final AggregateCache cache;

    public CachingRepository(Repository baseRepository) {
        this(baseRepository, ReadThroughAggregateCache::new);
    }

    /**
     * @param baseRepository 실제 저장소
     * @param cacheFactory 저장소를 감싸는 캐시 생성 함수
     */
    public CachingRepository(Repository baseRepository, Function<Repository, AggregateCache> cacheFactory) {
        if (baseRepository == null) {
            throw new IllegalArgumentException("baseRepository cannot be null");
        }
        if (cacheFactory == null) {
            throw new IllegalArgumentException("cacheFactory cannot be null");
        }
        AggregateCache created = cacheFactory.apply(baseRepository);
        if (created == null) {
            throw new IllegalArgumentException("cacheFactory returned null");
        }
        this.cache = created;
    }

    /**
     * @throws AggregateNotFoundException 캐시와 저장소 어디에서도 로드하지 못한 경우
     */
    public <T extends EventSource> T getById(UUID id, Supplier<T> factory) {
        Optional<T> aggregate = cache.getById(id, factory);
        if (aggregate.isEmpty()) {
            throw new AggregateNotFoundException(id, factory.get().getClass());
        }
        return aggregate.get();
    }

    public <T extends EventSource> Optional<T> tryGetById(UUID id, Supplier<T> factory) {
        return cache.getById(id, factory);
    }

    /**
     * @return 저장 성공 여부 (실패하면 캐시 항목이 제거됨)
     */
    public boolean save(EventSource aggregate) {
        return cache.save(aggregate);
    }

    public void clearCache(UUID id) {
        cache.remove(id);
    }

    public void clearCache() {
        cache.clear();
    }

    @Override
    public void close() {
        cache.close();
    }
}
