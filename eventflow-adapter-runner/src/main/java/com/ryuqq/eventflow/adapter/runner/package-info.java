/**
 * Runner Adapter Layer - 큐 기반 메시지 소비자.
 *
 * <p>발행 스레드와 소비 스레드를 분리하면서 FIFO 순서를 유지하는 큐 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.adapter.runner.SleepingQueuedHandler} - 전용 스레드, spin 후 sleep</li>
 *   <li>{@link com.ryuqq.eventflow.adapter.runner.ThreadPoolQueuedHandler} - 공유 풀, CAS로 단일 drain 보장</li>
 *   <li>{@link com.ryuqq.eventflow.adapter.runner.DiscardingQueuedHandler} - 최신 메시지만 처리</li>
 *   <li>{@link com.ryuqq.eventflow.adapter.runner.MultiQueuedHandler} - N개 파티션 큐</li>
 *   <li>{@link com.ryuqq.eventflow.adapter.runner.LaterService} - 지연 전송 스케줄러</li>
 *   <li>{@link com.ryuqq.eventflow.adapter.runner.QueuedSubscriber} - 큐 뒤에 내부 버스를 둔 구독자</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (QueuedHandler 구현체, LaterService)
 *   ↓ depends on
 * adapter-inmemory (InMemoryBus)
 *   ↓ depends on
 * core (Message, QueuedHandler SPI, TimeSource)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.adapter.runner;
