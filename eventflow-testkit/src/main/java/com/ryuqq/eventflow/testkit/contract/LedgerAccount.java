package com.ryuqq.eventflow.testkit.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.eventflow.core.aggregate.AggregateRoot;
import com.ryuqq.eventflow.core.message.Event;

import java.util.UUID;

/**
 * Fixture aggregate used by the contract tests.
 *
 * <p>A ledger is opened once and then credited any number of times. Each credit becomes one
 * event in the {@code ledgerAccount-<id>} stream.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LedgerAccount extends AggregateRoot {

    private long balance;

    /**
     * Rehydration constructor used by the repository.
     */
    public LedgerAccount() {
        register(LedgerOpened.class, e -> setId(e.getLedgerId()));
        register(LedgerCredited.class, e -> balance += e.getAmount());
    }

    public LedgerAccount(UUID id) {
        this();
        raise(new LedgerOpened(id));
    }

    public void credit(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive (current: " + amount + ")");
        }
        raise(new LedgerCredited(getId(), amount));
    }

    public long getBalance() {
        return balance;
    }

    /**
     * First event of every ledger stream.
     */
    public static class LedgerOpened extends Event {

        private final UUID ledgerId;

        @JsonCreator
        public LedgerOpened(@JsonProperty("ledgerId") UUID ledgerId) {
            this.ledgerId = ledgerId;
        }

        public UUID getLedgerId() {
            return ledgerId;
        }
    }

    public static class LedgerCredited extends Event {

        private final UUID ledgerId;
        private final long amount;

        @JsonCreator
        public LedgerCredited(@JsonProperty("ledgerId") UUID ledgerId, @JsonProperty("amount") long amount) {
            this.ledgerId = ledgerId;
            this.amount = amount;
        }

        public UUID getLedgerId() {
            return ledgerId;
        }

        public long getAmount() {
            return amount;
        }
    }
}
