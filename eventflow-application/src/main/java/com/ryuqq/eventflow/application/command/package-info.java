/**
 * Command 전송과 추적.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.application.command.QueuedDispatcher} - 버스 + Command API 구현체</li>
 *   <li>{@link com.ryuqq.eventflow.application.command.CommandManager} - Command id별 추적기 저장소</li>
 *   <li>{@link com.ryuqq.eventflow.application.command.CommandTracker} - Ack/완료 타임아웃 상태 머신</li>
 *   <li>{@link com.ryuqq.eventflow.application.command.DispatcherConfig} - 큐 수와 타임아웃 설정</li>
 * </ul>
 *
 * <h2>프로토콜</h2>
 * <pre>
 * send(cmd)
 *   1. CommandManager.registerCommand → AckTimeout, CompletionTimeout 예약
 *   2. cmd publish → 핸들러가 AckCommand publish → PENDING_RESPONSE
 *   3. 핸들러가 Success/Fail publish → COMPLETE
 *   4. 타임아웃이 먼저 오면 NotHandled / TimedOut 으로 확정, Canceled publish
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.application.command;
