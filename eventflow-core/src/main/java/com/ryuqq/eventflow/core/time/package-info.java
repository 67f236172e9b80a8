/**
 * 논리 시계 ({@link com.ryuqq.eventflow.core.time.TimeSource}, {@link com.ryuqq.eventflow.core.time.TimePosition}).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.core.time;
