package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.message.Event;
import com.ryuqq.eventflow.core.spi.Subscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * QueuedSubscriber 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class QueuedSubscriberTest {

    static final class Deposited extends Event {
    }

    static final class Withdrawn extends Event {
    }

    private QueuedSubscriber subscriber;

    @BeforeEach
    void setUp() {
        subscriber = new QueuedSubscriber("read-side");
    }

    @AfterEach
    void tearDown() {
        subscriber.close();
    }

    @Test
    void handle_구독한_핸들러가_소비_스레드에서_순서대로_호출됨() throws Exception {
        // given
        List<String> seen = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        subscriber.subscribe(Deposited.class, e -> {
            seen.add("deposited");
            threads.add(Thread.currentThread().getName());
            latch.countDown();
        });
        subscriber.subscribe(Withdrawn.class, e -> {
            seen.add("withdrawn");
            threads.add(Thread.currentThread().getName());
            latch.countDown();
        });

        // when
        subscriber.handle(new Deposited());
        subscriber.handle(new Withdrawn());
        subscriber.handle(new Deposited());

        // then
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).containsExactly("deposited", "withdrawn", "deposited");
        assertThat(threads).allMatch(name -> name.startsWith("read-side-queue"));
        assertThat(Thread.currentThread().getName()).doesNotStartWith("read-side-queue");
    }

    @Test
    void subscription_close_후에는_전달되지_않음() throws Exception {
        // given
        List<Event> seen = new CopyOnWriteArrayList<>();
        Subscription subscription = subscriber.subscribe(Deposited.class, seen::add);

        // when
        subscription.close();
        subscriber.handle(new Deposited());
        QueuedHandlerTest.awaitIdleSubscriber(subscriber);

        // then
        assertThat(seen).isEmpty();
        assertThat(subscriber.hasSubscriberFor(Deposited.class, false)).isFalse();
    }
}
