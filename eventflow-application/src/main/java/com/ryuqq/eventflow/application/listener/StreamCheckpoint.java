package com.ryuqq.eventflow.application.listener;

/**
 * 리스너 하나의 스트림 위치.
 *
 * @param streamName 스트림 이름
 * @param position 마지막으로 받은 이벤트 번호 (-1이면 아직 없음)
 */
public record StreamCheckpoint(String streamName, long position) {
}
