/**
 * Aggregate 영속화와 캐시.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.application.repository.StreamStoreRepository} - 스트림 재생/append 기반 저장소</li>
 *   <li>{@link com.ryuqq.eventflow.application.repository.ReadThroughAggregateCache} - 읽을 때마다 최신화하는 캐시</li>
 *   <li>{@link com.ryuqq.eventflow.application.repository.OptimisticCacheRepository} - 저장 성공 시에만 캐시</li>
 *   <li>{@link com.ryuqq.eventflow.application.repository.CachingRepository} - 캐시 전략 파사드</li>
 *   <li>{@link com.ryuqq.eventflow.application.repository.PrefixedCamelCaseStreamNameBuilder} - 스트림 이름 규칙</li>
 * </ul>
 *
 * <h2>동시성</h2>
 * <p>Aggregate 인스턴스는 thread-safe 하지 않습니다. 같은 인스턴스를 여러 스레드에서 변경/저장하면 안 됩니다.
 * 캐시는 자체 map 접근 외에 잠금을 추가하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.application.repository;
