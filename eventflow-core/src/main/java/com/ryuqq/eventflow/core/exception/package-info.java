/**
 * 타입이 있는 예외.
 *
 * <h2>분류</h2>
 * <ul>
 *   <li>not-found: {@link com.ryuqq.eventflow.core.exception.AggregateNotFoundException}, {@link com.ryuqq.eventflow.core.exception.StreamNotFoundException}</li>
 *   <li>deleted: {@link com.ryuqq.eventflow.core.exception.AggregateDeletedException}, {@link com.ryuqq.eventflow.core.exception.StreamDeletedException}</li>
 *   <li>version-conflict: {@link com.ryuqq.eventflow.core.exception.AggregateVersionException}, {@link com.ryuqq.eventflow.core.exception.WrongExpectedVersionException}</li>
 *   <li>not-handled / timed-out / oversubscribed / canceled: {@link com.ryuqq.eventflow.core.exception.CommandException} 하위 타입</li>
 *   <li>duplicate-registration: {@link com.ryuqq.eventflow.core.exception.ExistingHandlerException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.core.exception;
