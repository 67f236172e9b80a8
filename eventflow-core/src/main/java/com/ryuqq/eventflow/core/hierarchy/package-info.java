/**
 * 메시지 타입 계층.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.eventflow.core.hierarchy;
