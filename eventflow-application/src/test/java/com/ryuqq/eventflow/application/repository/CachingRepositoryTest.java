package com.ryuqq.eventflow.application.repository;

import com.ryuqq.eventflow.adapter.inmemory.store.InMemoryStreamStoreConnection;
import com.ryuqq.eventflow.application.serialization.JacksonEventSerializer;
import com.ryuqq.eventflow.application.support.TestAccount;
import com.ryuqq.eventflow.application.support.TestMember;
import com.ryuqq.eventflow.core.exception.AggregateNotFoundException;
import com.ryuqq.eventflow.core.spi.AggregateCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * CachingRepository 테스트.
 *
 * <p>기본 전략(ReadThrough)은 실제 저장소로, 주입 전략은 mock으로 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CachingRepositoryTest {

    private InMemoryStreamStoreConnection connection;
    private StreamStoreRepository baseRepository;
    private CachingRepository repository;

    @BeforeEach
    void setUp() {
        connection = new InMemoryStreamStoreConnection("caching-test");
        connection.connect();
        baseRepository = new StreamStoreRepository(
            new PrefixedCamelCaseStreamNameBuilder(), connection, new JacksonEventSerializer());
        repository = new CachingRepository(baseRepository);
    }

    @AfterEach
    void tearDown() {
        repository.close();
        connection.close();
    }

    @Test
    void getById_캐시된_인스턴스를_다른_writer의_이벤트로_최신화() {
        // given
        UUID id = UUID.randomUUID();
        TestAccount account = new TestAccount(id);
        assertThat(repository.save(account)).isTrue();
        TestAccount otherWriter = baseRepository.getById(id, TestAccount::new);
        otherWriter.deposit(25);
        baseRepository.save(otherWriter);

        // when
        TestAccount loaded = repository.getById(id, TestAccount::new);

        // then
        assertThat(loaded).isSameAs(account);
        assertThat(loaded.getBalance()).isEqualTo(25);
        assertThat(loaded.getExpectedVersion()).isEqualTo(1);
    }

    @Test
    void getById_같은_id를_쓰는_두_타입을_각각_로드() {
        // given
        UUID id = UUID.randomUUID();
        TestAccount account = new TestAccount(id);
        account.deposit(10);
        assertThat(repository.save(account)).isTrue();
        assertThat(repository.save(new TestMember(id, "kim"))).isTrue();

        // when
        TestAccount loadedAccount = repository.getById(id, TestAccount::new);
        TestMember loadedMember = repository.getById(id, TestMember::new);

        // then
        assertThat(loadedAccount.getBalance()).isEqualTo(10);
        assertThat(loadedMember.getNickname()).isEqualTo("kim");
        assertThat(loadedMember.getId()).isEqualTo(id);
    }

    @Test
    void getById_어디에도_없으면_AggregateNotFoundException() {
        assertThatThrownBy(() -> repository.getById(UUID.randomUUID(), TestAccount::new))
            .isInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    void tryGetById_어디에도_없으면_empty() {
        assertThat(repository.tryGetById(UUID.randomUUID(), TestAccount::new)).isEmpty();
    }

    @Test
    void save_충돌하면_false() {
        // given
        UUID id = UUID.randomUUID();
        repository.save(new TestAccount(id));
        TestAccount stale = baseRepository.getById(id, TestAccount::new);
        TestAccount fresh = baseRepository.getById(id, TestAccount::new);
        fresh.deposit(1);
        baseRepository.save(fresh);

        // when
        stale.deposit(2);

        // then
        assertThat(repository.save(stale)).isFalse();
    }

    @Test
    void clearCache_주입한_캐시로_위임() {
        // given
        AggregateCache cache = mock(AggregateCache.class);
        CachingRepository custom = new CachingRepository(baseRepository, repo -> cache);
        UUID id = UUID.randomUUID();

        // when
        custom.clearCache(id);
        custom.clearCache();
        custom.close();

        // then
        verify(cache).remove(id);
        verify(cache).clear();
        verify(cache).close();
    }
}
