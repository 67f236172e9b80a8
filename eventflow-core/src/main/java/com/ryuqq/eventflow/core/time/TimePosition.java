package com.ryuqq.eventflow.core.time;

import java.time.Duration;

/**
 * 논리 시계 위의 한 지점 (밀리초, 0 이상).
 *
 * <p>{@link TimeSource}가 반환하는 단조 증가 시각이며, LaterService의 발행 시점 정렬 키로 사용됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>값은 항상 0 이상 ({@link #minus(Duration)}은 {@link #START}에서 멈춤)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimePosition implements Comparable<TimePosition> {

    public static final TimePosition START = new TimePosition(0L);

    private final long millis;

    private TimePosition(long millis) {
        this.millis = millis;
    }

    /**
     * @param millis 시작점 기준 밀리초
     * @return TimePosition
     * @throws IllegalArgumentException millis가 음수인 경우
     */
    public static TimePosition ofMillis(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis cannot be negative, but was: " + millis);
        }
        return new TimePosition(millis);
    }

    public long toMillis() {
        return millis;
    }

    /**
     * 이 시점부터 {@code other}까지 남은 시간.
     *
     * @param other 목표 시점
     * @return 남은 시간 (other가 과거면 음수)
     */
    public Duration distanceUntil(TimePosition other) {
        return Duration.ofMillis(other.millis - millis);
    }

    public TimePosition plus(Duration duration) {
        return ofMillis(millis + duration.toMillis());
    }

    public TimePosition minus(Duration duration) {
        long value = millis - duration.toMillis();
        return value <= 0 ? START : new TimePosition(value);
    }

    public boolean isBefore(TimePosition other) {
        return millis < other.millis;
    }

    @Override
    public int compareTo(TimePosition other) {
        return Long.compare(millis, other.millis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return millis == ((TimePosition) o).millis;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(millis);
    }

    @Override
    public String toString() {
        return "TimePosition{" + millis + "ms}";
    }
}
