/**
 * 이벤트 소싱 Aggregate 베이스.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.core.aggregate;
