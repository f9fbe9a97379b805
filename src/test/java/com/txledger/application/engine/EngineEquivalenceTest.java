package com.txledger.application.engine;

import com.txledger.domain.model.AccountSnapshot;
import com.txledger.domain.model.LedgerStore;
import com.txledger.domain.model.TransactionRecord;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Serial and stream engines must agree on every account for the same input
 */
class EngineEquivalenceTest {

    private Vertx vertx;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
    }

    @AfterEach
    void tearDown() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 20240601L})
    void randomInput_sameSnapshotsFromBothEngines(long seed) throws Exception {
        List<TransactionRecord> input = TransactionFixtures.random(seed, 20, 5_000);

        SerialLedgerEngine serial = new SerialLedgerEngine(new LedgerStore());
        input.forEach(serial::process);
        List<AccountSnapshot> expected = serial.finish().result().snapshots();

        StreamLedgerEngine stream = new StreamLedgerEngine(vertx, new LedgerStore(), StreamLedgerEngineTest.config());
        input.forEach(stream::process);
        List<AccountSnapshot> actual = StreamLedgerEngineTest.await(stream.finish()).snapshots();

        assertEquals(expected.size(), actual.size());
        assertEquals(expected, actual);
        assertTrue(expected.stream().anyMatch(AccountSnapshot::isLocked), "input should exercise chargebacks");
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 12})
    void clientMajorInput_sameSnapshotsFromBothEngines(int clients) throws Exception {
        List<TransactionRecord> input = TransactionFixtures.clientMajor(clients);

        SerialLedgerEngine serial = new SerialLedgerEngine(new LedgerStore());
        input.forEach(serial::process);

        StreamLedgerEngine stream = new StreamLedgerEngine(vertx, new LedgerStore(), StreamLedgerEngineTest.config());
        input.forEach(stream::process);

        assertEquals(serial.finish().result().snapshots(), StreamLedgerEngineTest.await(stream.finish()).snapshots());
    }
}
