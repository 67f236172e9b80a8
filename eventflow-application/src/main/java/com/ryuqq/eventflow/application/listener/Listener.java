package com.ryuqq.eventflow.application.listener;

import com.ryuqq.eventflow.core.spi.EventSource;
import com.ryuqq.eventflow.core.spi.Subscriber;
import com.ryuqq.eventflow.core.statemachine.ListenerState;

import java.time.Duration;
import java.util.UUID;

/**
 * 스트림 하나를 catch-up 구독하는 리스너.
 *
 * <p>이력 재생 후 live 전환 시점에 {@link com.ryuqq.eventflow.core.message.CatchupSubscriptionBecameLive}를
 * {@link #eventStream()}에 한 번 publish 합니다.</p>
 *
 * <p><strong>상태:</strong> {@code NOT_STARTED → READING_HISTORY → LIVE → STOPPED}.
 * 한 인스턴스는 한 번만 시작할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Listener extends AutoCloseable {

    Duration DEFAULT_LIVE_TIMEOUT = Duration.ofMillis(1000);

    /**
     * 역직렬화된 이벤트가 publish 되는 구독 창구.
     */
    Subscriber eventStream();

    /**
     * @return 마지막으로 받은 이벤트 번호 (아직 없으면 시작 checkpoint, checkpoint도 없으면 -1)
     */
    long getPosition();

    String getStreamName();

    boolean isLive();

    ListenerState getState();

    /**
     * 이름으로 지정한 스트림을 구독합니다.
     *
     * @param streamName 정확한 스트림 이름
     * @param checkpoint 마지막으로 처리한 이벤트 번호 (exclusive, null이면 처음부터)
     * @param blockUntilLive true면 live 전환까지 timeout 동안 대기
     * @param timeout live 대기 시간
     * @throws IllegalStateException 이미 시작한 경우
     * @throws IllegalArgumentException 스트림이 없는 경우
     */
    void start(String streamName, Long checkpoint, boolean blockUntilLive, Duration timeout);

    default void start(String streamName) {
        start(streamName, null, false, DEFAULT_LIVE_TIMEOUT);
    }

    default void start(String streamName, Long checkpoint, boolean blockUntilLive) {
        start(streamName, checkpoint, blockUntilLive, DEFAULT_LIVE_TIMEOUT);
    }

    /**
     * Aggregate 인스턴스 스트림 ({@code camelName-id}).
     */
    void startForAggregate(
        Class<? extends EventSource> aggregateType,
        UUID id,
        Long checkpoint,
        boolean blockUntilLive,
        Duration timeout
    );

    /**
     * Aggregate category 스트림 ({@code $ce-camelName}).
     */
    void startForCategory(Class<? extends EventSource> aggregateType, Long checkpoint, boolean blockUntilLive, Duration timeout);

    /**
     * Event type 스트림 ({@code $et-TypeName}).
     *
     * @throws IllegalArgumentException Event 하위 타입이 아닌 경우
     */
    void startForEventType(Class<?> eventType, Long checkpoint, boolean blockUntilLive, Duration timeout);

    /**
     * 구독을 해제하고 내부 버스를 닫습니다. 두 번째 호출부터는 아무 일도 하지 않습니다.
     */
    @Override
    void close();
}
