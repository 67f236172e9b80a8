package com.ryuqq.eventflow.core.aggregate;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AggregateRoot 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AggregateRootTest {

    record Opened(UUID id) {
    }

    record Deposited(long amount) {
    }

    static final class Counter extends AggregateRoot {
        private long total;

        Counter() {
            register(Opened.class, e -> setId(e.id()));
            register(Deposited.class, e -> total += e.amount());
        }

        Counter(UUID id) {
            this();
            raise(new Opened(id));
        }

        void deposit(long amount) {
            raise(new Deposited(amount));
        }
    }

    @Test
    void raise_AppliesAndRecords() {
        // given
        UUID id = UUID.randomUUID();

        // when
        Counter counter = new Counter(id);
        counter.deposit(5);

        // then
        assertThat(counter.getId()).isEqualTo(id);
        assertThat(counter.total).isEqualTo(5);
        assertThat(counter.getExpectedVersion()).isEqualTo(-1);
        assertThat(counter.hasRecordedEvents()).isTrue();
    }

    @Test
    void takeEvents_AdvancesVersionAndClears() {
        // given
        Counter counter = new Counter(UUID.randomUUID());
        counter.deposit(1);

        // when
        List<Object> events = counter.takeEvents();

        // then
        assertThat(events).hasSize(2);
        assertThat(counter.getExpectedVersion()).isEqualTo(1);
        assertThat(counter.takeEvents()).isEmpty();
    }

    @Test
    void restoreFromEvents_CountsFromZero() {
        // given
        Counter counter = new Counter();
        UUID id = UUID.randomUUID();

        // when
        counter.restoreFromEvents(List.of(new Opened(id), new Deposited(3), new Deposited(4)));

        // then
        assertThat(counter.getId()).isEqualTo(id);
        assertThat(counter.total).isEqualTo(7);
        assertThat(counter.getExpectedVersion()).isEqualTo(2);
    }

    @Test
    void restoreFromEvents_WithPendingEvents_Throws() {
        // given
        Counter counter = new Counter(UUID.randomUUID());

        // when & then
        assertThatThrownBy(() -> counter.restoreFromEvents(List.of(new Deposited(1))))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void updateWithEvents_WrongExpectedVersion_Throws() {
        // given
        Counter counter = new Counter();
        counter.restoreFromEvents(List.of(new Opened(UUID.randomUUID())));

        // when & then
        assertThatThrownBy(() -> counter.updateWithEvents(List.of(new Deposited(1)), 3))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Expected version mismatch");
    }

    @Test
    void updateWithEvents_AppliesAfterCurrentVersion() {
        // given
        Counter counter = new Counter();
        counter.restoreFromEvents(List.of(new Opened(UUID.randomUUID())));

        // when
        counter.updateWithEvents(List.of(new Deposited(2), new Deposited(3)), 0);

        // then
        assertThat(counter.getExpectedVersion()).isEqualTo(2);
        assertThat(counter.total).isEqualTo(5);
    }

    @Test
    void register_SameTypeTwice_Throws() {
        // when & then
        assertThatThrownBy(() -> new AggregateRoot() {
            {
                register(Deposited.class, e -> { });
                register(Deposited.class, e -> { });
            }
        }).isInstanceOf(IllegalArgumentException.class);
    }
}
