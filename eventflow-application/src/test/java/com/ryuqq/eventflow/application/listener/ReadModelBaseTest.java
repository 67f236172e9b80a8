package com.ryuqq.eventflow.application.listener;

import com.ryuqq.eventflow.application.repository.StreamStoreRepository;
import com.ryuqq.eventflow.application.support.StoreFixture;
import com.ryuqq.eventflow.application.support.TestAccount;
import com.ryuqq.eventflow.core.spi.EventSerializer;
import com.ryuqq.eventflow.core.spi.StreamNameBuilder;
import com.ryuqq.eventflow.core.spi.StreamStoreConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static com.ryuqq.eventflow.application.support.StoreFixture.awaitUntil;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReadModelBase 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ReadModelBaseTest {

    private static final Duration LIVE_TIMEOUT = Duration.ofSeconds(5);

    private StoreFixture store;
    private StreamStoreRepository repository;
    private BalanceReadModel readModel;

    @BeforeEach
    void setUp() {
        store = new StoreFixture("read-model-test");
        repository = new StreamStoreRepository(store.nameBuilder, store.connection, store.serializer);
    }

    @AfterEach
    void tearDown() {
        if (readModel != null) {
            readModel.close();
        }
        store.close();
    }

    // ==================== 이력 재생 + live ====================

    @Test
    void startForAggregate_이력을_재생하고_live_이벤트까지_반영() throws Exception {
        // given
        TestAccount account = accountWithDeposits(10, 20, 30);
        readModel = new BalanceReadModel(store.connection, store.nameBuilder, store.serializer);

        // when
        readModel.startForAggregate(TestAccount.class, account.getId(), null, true, LIVE_TIMEOUT);

        // then
        assertThat(awaitUntil(() -> readModel.getVersion() == 4, 5000)).isTrue();
        assertThat(readModel.balance.get()).isEqualTo(60);
        assertThat(readModel.opened.get()).isEqualTo(1);

        // when
        account.deposit(40);
        repository.save(account);

        // then
        assertThat(awaitUntil(() -> readModel.balance.get() == 100, 5000)).isTrue();
        assertThat(readModel.getVersion()).isEqualTo(5);
    }

    @Test
    void getCheckpoint_listener마다_스트림과_위치를_반환() throws Exception {
        // given
        TestAccount account = accountWithDeposits(1, 2);
        readModel = new BalanceReadModel(store.connection, store.nameBuilder, store.serializer);
        readModel.startForAggregate(TestAccount.class, account.getId(), null, true, LIVE_TIMEOUT);

        // when
        List<StreamCheckpoint> checkpoints = readModel.getCheckpoint();

        // then
        assertThat(checkpoints).hasSize(1);
        assertThat(checkpoints.get(0).streamName())
            .isEqualTo(store.nameBuilder.generateForAggregate(TestAccount.class, account.getId()));
        assertThat(checkpoints.get(0).position()).isEqualTo(2);
    }

    @Test
    void start_checkpoint_이후_이벤트만_반영() throws Exception {
        // given
        TestAccount account = accountWithDeposits(10, 20, 30);
        String stream = store.nameBuilder.generateForAggregate(TestAccount.class, account.getId());
        readModel = new BalanceReadModel(store.connection, store.nameBuilder, store.serializer);

        // when
        readModel.start(stream, 1L, true, LIVE_TIMEOUT);

        // then
        assertThat(awaitUntil(() -> readModel.getVersion() == 2, 5000)).isTrue();
        assertThat(readModel.balance.get()).isEqualTo(50);
        assertThat(readModel.opened.get()).isZero();
    }

    @Test
    void startForCategory_여러_Aggregate를_합산() throws Exception {
        // given
        accountWithDeposits(5);
        accountWithDeposits(7, 8);
        readModel = new BalanceReadModel(store.connection, store.nameBuilder, store.serializer);

        // when
        readModel.startForCategory(TestAccount.class, null, true, LIVE_TIMEOUT);

        // then
        assertThat(awaitUntil(() -> readModel.getVersion() == 5, 5000)).isTrue();
        assertThat(readModel.balance.get()).isEqualTo(20);
        assertThat(readModel.opened.get()).isEqualTo(2);
    }

    @Test
    void reader가_없으면_listener만으로_재생() throws Exception {
        // given
        TestAccount account = accountWithDeposits(3, 4);
        String stream = store.nameBuilder.generateForAggregate(TestAccount.class, account.getId());
        readModel = new BalanceReadModel(
            () -> new StreamListener("balance", store.connection, store.nameBuilder, store.serializer),
            null
        );

        // when
        readModel.start(stream, null, true, LIVE_TIMEOUT);

        // then
        assertThat(awaitUntil(() -> readModel.balance.get() == 7, 5000)).isTrue();
        assertThat(awaitUntil(() -> readModel.getVersion() == 3, 5000)).isTrue();
    }

    // ==================== 종료 ====================

    @Test
    void close_두번_호출해도_안전하고_이후_start는_IllegalStateException() {
        // given
        readModel = new BalanceReadModel(store.connection, store.nameBuilder, store.serializer);

        // when
        readModel.close();
        readModel.close();

        // then
        assertThatThrownBy(() -> readModel.start("orders-1"))
            .isInstanceOf(IllegalStateException.class);
        assertThat(readModel.getCheckpoint()).isEmpty();
    }

    private TestAccount accountWithDeposits(long... amounts) {
        TestAccount account = new TestAccount(UUID.randomUUID());
        for (long amount : amounts) {
            account.deposit(amount);
        }
        repository.save(account);
        return account;
    }

    static class BalanceReadModel extends ReadModelBase {

        final AtomicLong balance = new AtomicLong();
        final AtomicLong opened = new AtomicLong();

        BalanceReadModel(StreamStoreConnection connection, StreamNameBuilder nameBuilder, EventSerializer serializer) {
            super("balance", connection, nameBuilder, serializer);
            registerHandlers();
        }

        BalanceReadModel(Supplier<Listener> listenerFactory, Supplier<StreamReader> readerFactory) {
            super("balance", listenerFactory, readerFactory);
            registerHandlers();
        }

        private void registerHandlers() {
            subscribe(TestAccount.Deposited.class, e -> balance.addAndGet(e.getAmount()));
            subscribe(TestAccount.Opened.class, e -> opened.incrementAndGet());
        }
    }
}
