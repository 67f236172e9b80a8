package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.exception.QueueStopTimeoutException;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.message.QueueAffineMessage;
import com.ryuqq.eventflow.core.spi.QueuedHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MultiQueuedHandler 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class MultiQueuedHandlerTest {

    static final class Plain extends Message {
    }

    static final class Affine extends Message implements QueueAffineMessage {
        final int key;
        final int seq;

        Affine(int key, int seq) {
            this.key = key;
            this.seq = seq;
        }

        @Override
        public int queueId() {
            return key;
        }
    }

    @Mock
    private QueuedHandler first;

    @Mock
    private QueuedHandler second;

    @Mock
    private QueuedHandler third;

    private MultiQueuedHandler multi;

    @BeforeEach
    void setUp() {
        List<QueuedHandler> queues = List.of(first, second, third);
        multi = new MultiQueuedHandler("multi", 3, queues::get, null);
    }

    // ============================================================
    // 1. 라우팅
    // ============================================================

    @Test
    void publish_QueueAffineMessage는_queueId_mod_N_큐로_감() {
        // given
        Affine message = new Affine(4, 0);

        // when
        multi.publish(message);

        // then
        verify(second).publish(message);
        verify(first, never()).publish(message);
        verify(third, never()).publish(message);
    }

    @Test
    void publish_음수_queueId도_floorMod로_라우팅함() {
        // given
        Affine message = new Affine(-1, 0);

        // when
        multi.publish(message);

        // then
        verify(third).publish(message);
    }

    @Test
    void publish_기본_해시는_라운드로빈() {
        // given
        Plain a = new Plain();
        Plain b = new Plain();
        Plain c = new Plain();

        // when
        multi.publish(a);
        multi.publish(b);
        multi.publish(c);

        // then
        verify(first).publish(a);
        verify(second).publish(b);
        verify(third).publish(c);
    }

    @Test
    void publishToAll_모든_큐에_전달함() {
        // given
        Plain message = new Plain();

        // when
        multi.publishToAll(message);

        // then
        verify(first).publish(message);
        verify(second).publish(message);
        verify(third).publish(message);
    }

    // ============================================================
    // 2. 상태 집계
    // ============================================================

    @Test
    void isIdle_하나라도_바쁘면_false() {
        // given
        when(first.isIdle()).thenReturn(true);
        when(second.isIdle()).thenReturn(false);

        // when & then
        assertThat(multi.isIdle()).isFalse();
    }

    @Test
    void messageCount_모든_큐의_합() {
        // given
        when(first.messageCount()).thenReturn(1);
        when(second.messageCount()).thenReturn(2);
        when(third.messageCount()).thenReturn(3);

        // when & then
        assertThat(multi.messageCount()).isEqualTo(6);
    }

    // ============================================================
    // 3. 생명주기
    // ============================================================

    @Test
    void stop_모든_큐에_중지를_먼저_알리고_각각_대기함() {
        // when
        multi.stop();

        // then
        verify(first).requestStop();
        verify(second).requestStop();
        verify(third).requestStop();
        verify(first).stop();
        verify(second).stop();
        verify(third).stop();
    }

    @Test
    void stop_하나가_실패해도_나머지를_기다린_뒤_예외() {
        // given
        doThrow(new QueueStopTimeoutException("multi-0")).when(first).stop();

        // when & then
        assertThatThrownBy(multi::stop)
            .isInstanceOf(QueueStopTimeoutException.class)
            .hasMessageContaining("multi-0");
        verify(second).stop();
        verify(third).stop();
    }

    @Test
    void constructor_queueCount가_0이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new MultiQueuedHandler("bad", 0, i -> first, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queueCount must be positive");
    }

    // ============================================================
    // 4. 실제 큐로 파티션 내 순서 검증
    // ============================================================

    @Test
    void publish_같은_키는_같은_큐에서_순서대로_처리됨() throws Exception {
        // given
        int perKey = 200;
        Map<Integer, List<Integer>> seenByKey = new ConcurrentHashMap<>();
        CountDownLatch latch = new CountDownLatch(perKey * 4);
        MultiQueuedHandler real = new MultiQueuedHandler("partitioned", 4, message -> {
            Affine affine = (Affine) message;
            seenByKey.computeIfAbsent(affine.key, k -> new CopyOnWriteArrayList<>()).add(affine.seq);
            latch.countDown();
        }, new QueuedHandlerConfig(), null);
        real.start();

        // when
        for (int seq = 0; seq < perKey; seq++) {
            for (int key = 0; key < 4; key++) {
                real.publish(new Affine(key, seq));
            }
        }

        // then
        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        for (int key = 0; key < 4; key++) {
            assertThat(seenByKey.get(key)).isSorted().hasSize(perKey);
        }
        real.stop();
    }
}
