package com.ryuqq.eventflow.testkit.contract;

import com.ryuqq.eventflow.core.exception.AggregateVersionException;
import com.ryuqq.eventflow.core.exception.WrongExpectedVersionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for aggregate versioning.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Load at an exact version → state as of that version</li>
 *   <li>Load beyond the stream → {@link AggregateVersionException}</li>
 *   <li>Two writers from the same version → second save fails</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AggregateVersionContractTest extends AbstractContractTest {

    @Test
    void testGetById_AtExactVersion_RestoresStateAtThatVersion() {
        // Given: opened + 4 credits = 5 events
        LedgerAccount ledger = openLedger(10, 20, 30, 40);

        // When
        LedgerAccount atThree = repository.getById(ledger.getId(), 3, LedgerAccount::new);

        // Then: opened + 10 + 20
        assertEquals(30, atThree.getBalance());
        assertEquals(2, atThree.getExpectedVersion());
    }

    @Test
    void testGetById_VersionBeyondStream_ThrowsAggregateVersionException() {
        // Given: 5 events
        LedgerAccount ledger = openLedger(10, 20, 30, 40);

        // When & Then
        assertThrows(AggregateVersionException.class,
                () -> repository.getById(ledger.getId(), 10, LedgerAccount::new),
                "Requesting version 10 of a 5 event stream should fail");
    }

    @Test
    void testSave_ConcurrentWritersFromSameVersion_SecondSaveFails() {
        // Given
        LedgerAccount ledger = openLedger(10);
        LedgerAccount first = repository.getById(ledger.getId(), LedgerAccount::new);
        LedgerAccount second = repository.getById(ledger.getId(), LedgerAccount::new);

        // When
        first.credit(1);
        repository.save(first);
        second.credit(2);

        // Then
        assertThrows(WrongExpectedVersionException.class, () -> repository.save(second));
        assertLastEventNumber(streamOf(ledger), 2);
        assertEquals(11, repository.getById(ledger.getId(), LedgerAccount::new).getBalance());
    }
}
