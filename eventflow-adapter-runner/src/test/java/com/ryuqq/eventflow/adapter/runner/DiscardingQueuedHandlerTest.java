package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.message.Message;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DiscardingQueuedHandler 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class DiscardingQueuedHandlerTest {

    static final class Tick extends Message {
        final int seq;

        Tick(int seq) {
            this.seq = seq;
        }
    }

    @Test
    void publish_처리가_밀리면_중간_메시지를_버리고_마지막은_처리함() throws Exception {
        // given
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch lastSeen = new CountDownLatch(1);
        List<Integer> seen = new CopyOnWriteArrayList<>();
        DiscardingQueuedHandler queue = new DiscardingQueuedHandler("discarding", message -> {
            int seq = ((Tick) message).seq;
            seen.add(seq);
            if (seq == 0) {
                firstEntered.countDown();
                QueuedHandlerTest.awaitQuietly(release);
            }
            if (seq == 100) {
                lastSeen.countDown();
            }
        });
        queue.start();
        queue.publish(new Tick(0));
        assertThat(firstEntered.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        for (int i = 1; i <= 100; i++) {
            queue.publish(new Tick(i));
        }
        release.countDown();

        // then
        assertThat(lastSeen.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).containsExactly(0, 100);
        assertThat(queue.discardedCount()).isEqualTo(99);
        queue.stop();
    }

    @Test
    void publish_처리가_밀리지_않으면_모두_처리함() throws Exception {
        // given
        CountDownLatch latch = new CountDownLatch(3);
        List<Integer> seen = new CopyOnWriteArrayList<>();
        DiscardingQueuedHandler queue = new DiscardingQueuedHandler("steady", message -> {
            seen.add(((Tick) message).seq);
            latch.countDown();
        });
        queue.start();

        // when
        for (int i = 0; i < 3; i++) {
            queue.publish(new Tick(i));
            QueuedHandlerTest.awaitIdle(queue);
        }

        // then
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).containsExactly(0, 1, 2);
        queue.stop();
    }
}
