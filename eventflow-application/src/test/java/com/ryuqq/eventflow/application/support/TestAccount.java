package com.ryuqq.eventflow.application.support;

import com.ryuqq.eventflow.core.aggregate.AggregateRoot;
import com.ryuqq.eventflow.core.message.Event;

import java.util.UUID;

/**
 * 저장소/리스너 테스트용 Aggregate.
 */
public class TestAccount extends AggregateRoot {

    private long balance;

    public TestAccount() {
        register(Opened.class, e -> setId(e.accountId));
        register(Deposited.class, e -> balance += e.amount);
    }

    public TestAccount(UUID id) {
        this();
        raise(new Opened(id));
    }

    public void deposit(long amount) {
        raise(new Deposited(amount));
    }

    public long getBalance() {
        return balance;
    }

    public static class Opened extends Event {
        private final UUID accountId;

        private Opened() {
            this.accountId = null;
        }

        public Opened(UUID accountId) {
            this.accountId = accountId;
        }

        public UUID getAccountId() {
            return accountId;
        }
    }

    public static class Deposited extends Event {
        private final long amount;

        private Deposited() {
            this.amount = 0;
        }

        public Deposited(long amount) {
            this.amount = amount;
        }

        public long getAmount() {
            return amount;
        }
    }
}
