/**
 * 상태 머신.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.eventflow.core.statemachine.CommandState} - Command 추적 상태</li>
 *   <li>{@link com.ryuqq.eventflow.core.statemachine.ListenerState} - Catch-up 리스너 상태</li>
 *   <li>{@link com.ryuqq.eventflow.core.statemachine.StateTransition} - 전이 검증</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.core.statemachine;
