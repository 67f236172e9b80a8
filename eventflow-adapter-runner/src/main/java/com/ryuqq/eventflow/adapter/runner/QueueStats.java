package com.ryuqq.eventflow.adapter.runner;

/**
 * 큐 하나의 스냅샷.
 *
 * @param name 큐 이름
 * @param length 대기 중인 메시지 수
 * @param idle 비어 있고 처리 중인 메시지가 없는지 여부
 * @param processed 지금까지 처리한 메시지 수
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueueStats(String name, int length, boolean idle, long processed) {
}
