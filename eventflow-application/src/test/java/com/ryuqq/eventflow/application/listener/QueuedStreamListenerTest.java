package com.ryuqq.eventflow.application.listener;

import com.ryuqq.eventflow.application.support.StoreFixture;
import com.ryuqq.eventflow.application.support.TestAccount;
import com.ryuqq.eventflow.core.message.CatchupSubscriptionBecameLive;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.Subscription;
import com.ryuqq.eventflow.core.statemachine.ListenerState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.ryuqq.eventflow.application.support.StoreFixture.awaitUntil;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * QueuedStreamListener 테스트.
 *
 * <p>큐를 거친 전달 순서, live 전환 시점, pause/resume을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class QueuedStreamListenerTest {

    private StoreFixture store;
    private QueuedStreamListener listener;
    private final List<Message> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        store = new StoreFixture("queued-listener-test");
        listener = new QueuedStreamListener("queued-listener", store.connection, store.nameBuilder, store.serializer);
    }

    @AfterEach
    void tearDown() {
        listener.close();
        store.close();
    }

    @Test
    void start_느린_핸들러에서도_저장_순서대로_전달() throws Exception {
        // given
        String stream = "orders-" + UUID.randomUUID();
        store.appendDeposits(stream, 20);
        listener.eventStream().subscribeToAll(message -> {
            sleepQuietly(2);
            received.add(message);
        });

        // when
        listener.start(stream, null, true, Duration.ofSeconds(10));

        // then
        assertThat(awaitUntil(() -> received.size() == 21, 5000)).isTrue();
        for (int i = 0; i < 20; i++) {
            assertThat(((TestAccount.Deposited) received.get(i)).getAmount()).isEqualTo(i);
        }
        assertThat(received.get(20)).isInstanceOf(CatchupSubscriptionBecameLive.class);
    }

    @Test
    void start_blockUntilLive는_큐에_쌓인_이력을_모두_전달한_뒤_반환() {
        // given
        String stream = "orders-" + UUID.randomUUID();
        store.appendDeposits(stream, 10);
        listener.eventStream().subscribeToAll(message -> {
            sleepQuietly(20);
            received.add(message);
        });

        // when
        listener.start(stream, null, true, Duration.ofSeconds(10));

        // then
        assertThat(listener.isLive()).isTrue();
        assertThat(received.stream().filter(m -> m instanceof TestAccount.Deposited)).hasSize(10);
        assertThat(listener.getPosition()).isEqualTo(9);
    }

    @Test
    void pause_중에는_전달하지_않고_핸들을_닫으면_재개() throws Exception {
        // given
        String stream = "orders-" + UUID.randomUUID();
        store.appendDeposits(stream, 3);
        listener.eventStream().subscribeToAll(received::add);
        Subscription pause = listener.pause();

        // when
        listener.start(stream, null, false, Duration.ofSeconds(1));
        Thread.sleep(100);

        // then
        assertThat(listener.isPaused()).isTrue();
        assertThat(received).isEmpty();
        assertThat(listener.getState()).isEqualTo(ListenerState.READING_HISTORY);

        // when
        pause.close();

        // then
        assertThat(awaitUntil(() -> received.size() == 4, 5000)).isTrue();
        assertThat(listener.isPaused()).isFalse();
        assertThat(listener.isLive()).isTrue();
        assertThat(listener.pendingCount()).isZero();
    }

    @Test
    void close_pause_중이어도_대기_없이_종료() {
        // given
        String stream = "orders-" + UUID.randomUUID();
        store.appendDeposits(stream, 3);
        listener.eventStream().subscribeToAll(received::add);
        listener.pause();
        listener.start(stream);

        // when
        listener.close();

        // then
        assertThat(listener.getState()).isEqualTo(ListenerState.STOPPED);
        assertThat(received).isEmpty();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
