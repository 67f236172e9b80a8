package com.ryuqq.eventflow.adapter.runner;

import com.ryuqq.eventflow.core.message.DelaySendEnvelope;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.spi.Publisher;
import com.ryuqq.eventflow.core.time.MonotonicTimeSource;
import com.ryuqq.eventflow.core.time.TimeSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * LaterService 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LaterServiceTest {

    static final class Reminder extends Message {
    }

    @Mock
    private Publisher publisher;

    private final TimeSource timeSource = new MonotonicTimeSource();
    private LaterService laterService;

    @BeforeEach
    void setUp() {
        laterService = new LaterService(publisher, timeSource);
        laterService.start();
    }

    @AfterEach
    void tearDown() {
        laterService.close();
    }

    @Test
    void handle_지연_시간이_지나면_publish함() {
        // given
        Reminder reminder = new Reminder();

        // when
        laterService.handle(new DelaySendEnvelope(timeSource, Duration.ofMillis(50), reminder));

        // then
        verify(publisher, timeout(2000)).publish(reminder);
    }

    @Test
    void handle_지연_시간_전에는_publish하지_않음() {
        // given
        Reminder reminder = new Reminder();

        // when
        laterService.handle(new DelaySendEnvelope(timeSource, Duration.ofSeconds(5), reminder));

        // then
        verify(publisher, after(200).never()).publish(any());
        assertThat(laterService.pendingCount()).isEqualTo(1);
    }

    @Test
    void handle_발송_시각_순서대로_publish함() {
        // given
        Reminder late = new Reminder();
        Reminder early = new Reminder();

        // when
        laterService.handle(new DelaySendEnvelope(timeSource, Duration.ofMillis(150), late));
        laterService.handle(new DelaySendEnvelope(timeSource, Duration.ofMillis(20), early));

        // then
        verify(publisher, timeout(2000)).publish(late);
        InOrder order = inOrder(publisher);
        order.verify(publisher).publish(early);
        order.verify(publisher).publish(late);
    }

    @Test
    void handle_publish_예외가_나도_다음_예약을_처리함() {
        // given
        Reminder failing = new Reminder();
        Reminder next = new Reminder();
        doThrow(new IllegalStateException("boom")).when(publisher).publish(failing);

        // when
        laterService.handle(new DelaySendEnvelope(timeSource, Duration.ofMillis(10), failing));
        laterService.handle(new DelaySendEnvelope(timeSource, Duration.ofMillis(30), next));

        // then
        verify(publisher, timeout(2000)).publish(next);
    }

    @Test
    void close_남은_예약은_발송하지_않고_버림() {
        // given
        laterService.handle(new DelaySendEnvelope(timeSource, Duration.ofSeconds(5), new Reminder()));

        // when
        laterService.close();

        // then
        assertThat(laterService.pendingCount()).isZero();
        verify(publisher, never()).publish(any());
    }

    @Test
    void start_두번_호출하면_IllegalStateException() {
        assertThatThrownBy(laterService::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Already started");
    }
}
