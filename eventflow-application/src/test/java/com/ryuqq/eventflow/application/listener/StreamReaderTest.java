package com.ryuqq.eventflow.application.listener;

import com.ryuqq.eventflow.application.support.StoreFixture;
import com.ryuqq.eventflow.application.support.TestAccount;
import com.ryuqq.eventflow.core.exception.StreamStoreConnectionException;
import com.ryuqq.eventflow.core.message.Message;
import com.ryuqq.eventflow.core.model.ExpectedVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StreamReader 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StreamReaderTest {

    private StoreFixture store;
    private StreamReader reader;
    private final List<Message> received = new ArrayList<>();
    private String stream;

    @BeforeEach
    void setUp() {
        store = new StoreFixture("reader-test");
        reader = new StreamReader("test-reader", store.connection, store.nameBuilder, store.serializer, received::add);
        stream = "orders-" + UUID.randomUUID();
    }

    @AfterEach
    void tearDown() {
        reader.close();
        store.close();
    }

    // ==================== 정방향 / 역방향 ====================

    @Test
    void read_여러_페이지에_걸친_스트림을_끝까지_읽음() {
        // given
        store.appendDeposits(stream, 600);

        // when
        boolean read = reader.read(stream, () -> true);

        // then
        assertThat(read).isTrue();
        assertThat(received).hasSize(600);
        assertThat(amountAt(599)).isEqualTo(599);
        assertThat(reader.getPosition()).isEqualTo(599L);
        assertThat(reader.getStreamName()).isEqualTo(stream);
    }

    @Test
    void read_checkpoint_다음부터_count만큼만_읽음() {
        // given
        store.appendDeposits(stream, 10);

        // when
        boolean read = reader.read(stream, null, 3L, 4L, false);

        // then
        assertThat(read).isTrue();
        assertThat(received).hasSize(4);
        assertThat(amountAt(0)).isEqualTo(4);
        assertThat(reader.getPosition()).isEqualTo(7L);
    }

    @Test
    void read_역방향은_끝에서부터_count만큼_읽음() {
        // given
        store.appendDeposits(stream, 10);

        // when
        boolean read = reader.read(stream, null, null, 3L, true);

        // then
        assertThat(read).isTrue();
        assertThat(received).hasSize(3);
        assertThat(amountAt(0)).isEqualTo(9);
        assertThat(amountAt(2)).isEqualTo(7);
        assertThat(reader.getPosition()).isEqualTo(7L);
    }

    @Test
    void read_역방향_checkpoint_이전_이벤트만_읽음() {
        // given
        store.appendDeposits(stream, 10);

        // when
        reader.read(stream, null, 5L, null, true);

        // then
        assertThat(received).hasSize(5);
        assertThat(amountAt(0)).isEqualTo(4);
        assertThat(amountAt(4)).isEqualTo(0);
    }

    @Test
    void read_역방향_checkpoint_0이면_읽을_것이_없음() {
        // given
        store.appendDeposits(stream, 5);

        // when
        boolean read = reader.read(stream, null, 0L, null, true);

        // then
        assertThat(read).isFalse();
        assertThat(received).isEmpty();
        assertThat(reader.getPosition()).isNull();
    }

    // ==================== 검증 ====================

    @Test
    void read_없는_스트림이면_false() {
        assertThat(reader.read("missing-" + UUID.randomUUID(), () -> true)).isFalse();
        assertThat(received).isEmpty();
    }

    @Test
    void read_삭제된_스트림이면_false() {
        // given
        store.appendDeposits(stream, 2);
        store.connection.deleteStream(stream, ExpectedVersion.ANY);

        // when & then
        assertThat(reader.read(stream, () -> true)).isFalse();
    }

    @Test
    void read_연결이_닫혀_있으면_없는_스트림으로_보지_않고_예외() {
        // given
        store.appendDeposits(stream, 2);
        store.connection.close();

        // when & then
        assertThatThrownBy(() -> reader.read(stream, () -> true))
            .isInstanceOf(StreamStoreConnectionException.class);
        assertThat(received).isEmpty();
    }

    @Test
    void read_음수_checkpoint이면_IllegalArgumentException() {
        assertThatThrownBy(() -> reader.read(stream, null, -1L, null, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void read_count가_0이면_IllegalArgumentException() {
        assertThatThrownBy(() -> reader.read(stream, null, null, 0L, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readForEventType_Event가_아닌_타입이면_IllegalArgumentException() {
        assertThatThrownBy(() -> reader.readForEventType(Object.class, null, null, null, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readForEventType_et_스트림을_읽음() {
        // given
        store.appendDeposits(stream, 3);

        // when
        boolean read = reader.readForEventType(TestAccount.Deposited.class, null, null, null, false);

        // then
        assertThat(read).isTrue();
        assertThat(received).hasSize(3);
        assertThat(reader.getStreamName()).isEqualTo("$et-Deposited");
    }

    // ==================== 완료 대기 / 취소 ====================

    @Test
    void read_completionCheck가_true가_될_때까지_대기() {
        // given
        store.appendDeposits(stream, 2);
        AtomicInteger checks = new AtomicInteger();

        // when
        reader.read(stream, () -> checks.incrementAndGet() >= 5);

        // then
        assertThat(checks.get()).isEqualTo(5);
    }

    @Test
    void read_completionCheck_예외는_완료로_간주() {
        // given
        store.appendDeposits(stream, 2);

        // when
        boolean read = reader.read(stream, () -> {
            throw new IllegalStateException("check failed");
        });

        // then
        assertThat(read).isTrue();
    }

    @Test
    void cancel_핸들러에서_취소하면_남은_이벤트를_전달하지_않음() {
        // given
        store.appendDeposits(stream, 600);
        reader.setHandler(message -> {
            received.add(message);
            if (received.size() == 10) {
                reader.cancel();
            }
        });

        // when
        reader.read(stream, null);

        // then
        assertThat(received).hasSize(10);
        assertThat(reader.getPosition()).isEqualTo(9L);
    }

    private long amountAt(int index) {
        return ((TestAccount.Deposited) received.get(index)).getAmount();
    }
}
