package com.ryuqq.eventflow.application.repository;

import com.ryuqq.eventflow.core.spi.EventSource;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Aggregate 캐시 키. 같은 id라도 타입이 다르면 별개의 항목입니다.
 *
 * @param type Aggregate 구현 타입
 * @param id Aggregate ID
 * @author Orchestrator Team
 * @since 1.0.0
 */
record AggregateKey(Class<?> type, UUID id) {

    AggregateKey {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    static AggregateKey of(EventSource aggregate) {
        return new AggregateKey(aggregate.getClass(), aggregate.getId());
    }

    static AggregateKey of(UUID id, Supplier<? extends EventSource> factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        return new AggregateKey(factory.get().getClass(), id);
    }
}
