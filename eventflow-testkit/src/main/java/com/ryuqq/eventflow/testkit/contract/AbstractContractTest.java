package com.ryuqq.eventflow.testkit.contract;

import com.ryuqq.eventflow.adapter.inmemory.store.InMemoryStreamStoreConnection;
import com.ryuqq.eventflow.application.repository.PrefixedCamelCaseStreamNameBuilder;
import com.ryuqq.eventflow.application.repository.StreamStoreRepository;
import com.ryuqq.eventflow.application.serialization.JacksonEventSerializer;
import com.ryuqq.eventflow.core.model.EventData;
import com.ryuqq.eventflow.core.model.ExpectedVersion;
import com.ryuqq.eventflow.core.model.StreamEventsSlice;
import com.ryuqq.eventflow.core.model.WriteResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>This class wires the in-memory stream store, the Jackson serializer, the default stream
 * naming and a {@link StreamStoreRepository} so that each contract test runs the real runtime
 * end to end without an external store.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryStreamStoreConnection: stream store with category and event-type projections</li>
 *   <li>JacksonEventSerializer: event payload and header codec</li>
 *   <li>PrefixedCamelCaseStreamNameBuilder: {@code ledgerAccount-<id>} stream names</li>
 *   <li>StreamStoreRepository: aggregate persistence over the store</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         LedgerAccount account = openLedger(10, 20);
 *
 *         LedgerAccount loaded = repository.getById(account.getId(), LedgerAccount::new);
 *
 *         assertEquals(30, loaded.getBalance());
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected InMemoryStreamStoreConnection connection;
    protected JacksonEventSerializer serializer;
    protected PrefixedCamelCaseStreamNameBuilder streamNameBuilder;
    protected StreamStoreRepository repository;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates a fresh, connected store for every test.</p>
     */
    @BeforeEach
    void setUp() {
        connection = new InMemoryStreamStoreConnection("contract-" + UUID.randomUUID());
        connection.connect();
        serializer = new JacksonEventSerializer();
        streamNameBuilder = new PrefixedCamelCaseStreamNameBuilder();
        repository = new StreamStoreRepository(streamNameBuilder, connection, serializer);
    }

    /**
     * Closes the store and drops every open subscription.
     */
    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
    }

    /**
     * Creates and saves a ledger with the given credits.
     *
     * @param credits amounts credited after opening
     * @return the saved ledger (no pending events)
     */
    protected LedgerAccount openLedger(long... credits) {
        LedgerAccount ledger = new LedgerAccount(UUID.randomUUID());
        for (long credit : credits) {
            ledger.credit(credit);
        }
        repository.save(ledger);
        return ledger;
    }

    /**
     * @return the aggregate stream name of the ledger
     */
    protected String streamOf(LedgerAccount ledger) {
        return streamNameBuilder.generateForAggregate(LedgerAccount.class, ledger.getId());
    }

    /**
     * Appends raw events to a stream without version checks.
     *
     * @param stream the stream name
     * @param events the events to serialize and append
     * @return the number of the last event written
     */
    protected long appendEvents(String stream, Object... events) {
        EventData[] data = new EventData[events.length];
        for (int i = 0; i < events.length; i++) {
            data[i] = serializer.serialize(events[i], Map.of());
        }
        WriteResult result = connection.appendToStream(stream, ExpectedVersion.ANY, data);
        return result.nextExpectedVersion();
    }

    /**
     * Asserts that the last event number of the stream equals {@code expected}.
     *
     * @param stream the stream name
     * @param expected the expected last event number
     */
    protected void assertLastEventNumber(String stream, long expected) {
        StreamEventsSlice slice = connection.readStreamBackward(stream, -1, 1);
        assertEquals(expected, slice.getLastEventNumber(),
                String.format("Expected last event number %d but was %d for stream %s",
                        expected, slice.getLastEventNumber(), stream));
    }

    /**
     * Polls the condition until it holds or the timeout passes.
     *
     * @param condition the condition to wait for
     * @param timeout maximum wait
     * @param message failure message
     */
    protected void awaitCondition(BooleanSupplier condition, Duration timeout, String message) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message + " (waited " + timeout.toMillis() + "ms)");
            }
            sleep(5);
        }
    }

    /**
     * Sleeps for the specified duration. Used for timing-sensitive tests.
     *
     * @param millis milliseconds to sleep
     */
    protected void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
