/**
 * 스트림 catch-up 구독과 read model.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.application.listener.StreamListener} - 구독 스레드에서 바로 전달</li>
 *   <li>{@link com.ryuqq.eventflow.application.listener.QueuedStreamListener} - 순서 보장 큐를 거쳐 전달, pause 지원</li>
 *   <li>{@link com.ryuqq.eventflow.application.listener.StreamReader} - 일회성 페이지 읽기</li>
 *   <li>{@link com.ryuqq.eventflow.application.listener.ReadModelBase} - reader로 이력을 읽고 listener로 이어받는 read model</li>
 * </ul>
 *
 * <h2>순서 보장</h2>
 * <p>스트림 하나 안에서는 항상 이력 → live 마커 → live 이벤트 순서입니다.
 * live 이벤트가 이력보다 먼저 전달되는 일은 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.application.listener;
