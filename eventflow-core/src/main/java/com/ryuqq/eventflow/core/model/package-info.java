/**
 * 스트림 스토어 Value Object.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.core.model.EventData} / {@link com.ryuqq.eventflow.core.model.RecordedEvent} - 쓰기/읽기 이벤트</li>
 *   <li>{@link com.ryuqq.eventflow.core.model.StreamEventsSlice} - 페이지 읽기 결과 (+ not-found/deleted 센티널)</li>
 *   <li>{@link com.ryuqq.eventflow.core.model.ExpectedVersion} - 낙관적 동시성 특수값</li>
 *   <li>{@link com.ryuqq.eventflow.core.model.CatchUpSubscriptionSettings} - 구독 설정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.core.model;
