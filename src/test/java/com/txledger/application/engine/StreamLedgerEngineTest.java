package com.txledger.application.engine;

import com.txledger.domain.exception.ArithmeticOverflowException;
import com.txledger.domain.model.AccountSnapshot;
import com.txledger.domain.model.Amount;
import com.txledger.domain.model.LedgerStore;
import com.txledger.domain.model.TransactionRecord;
import com.txledger.infrastructure.config.EngineConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamLedgerEngine against a real Vert.x instance
 */
class StreamLedgerEngineTest {

    private Vertx vertx;
    private LedgerStore store;
    private StreamLedgerEngine engine;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        store = new LedgerStore();
        engine = new StreamLedgerEngine(vertx, store, config());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void finish_mixedClients_producesExpectedSnapshots() throws Exception {
        TransactionFixtures.mixedClients().forEach(engine::process);

        LedgerStore result = await(engine.finish());

        assertSame(store, result);
        assertEquals(List.of(
                new AccountSnapshot(1, amount("7.5"), Amount.ZERO, amount("7.5"), true),
                new AccountSnapshot(2, amount("9.0"), Amount.ZERO, amount("9.0"), false)
        ), result.snapshots());
    }

    @Test
    void finish_withoutInput_returnsEmptyStore() throws Exception {
        assertTrue(await(engine.finish()).snapshots().isEmpty());
    }

    @Test
    void finish_undeploysEveryWorker() throws Exception {
        TransactionFixtures.clientMajor(5).forEach(engine::process);
        assertEquals(5, vertx.deploymentIDs().size());

        await(engine.finish());

        assertTrue(vertx.deploymentIDs().isEmpty());
    }

    @Test
    void process_keepsPerClientOrder() throws Exception {
        List<TransactionRecord> input = TransactionFixtures.clientMajor(8);
        input.forEach(engine::process);

        for (AccountSnapshot snapshot : await(engine.finish()).snapshots()) {
            assertEquals(amount("4.0"), snapshot.getAvailable(), "client " + snapshot.getClient());
            assertEquals(Amount.ZERO, snapshot.getHeld(), "client " + snapshot.getClient());
        }
    }

    @Test
    void overflow_failsRunAfterOtherClientsDrain() {
        engine.process(TransactionRecord.deposit(1, 1, Amount.ofScaled(Long.MAX_VALUE)));
        engine.process(TransactionRecord.deposit(2, 2, amount("5.0")));
        engine.process(TransactionRecord.deposit(1, 3, amount("0.0001")));
        engine.process(TransactionRecord.deposit(2, 4, amount("1.0")));

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(engine.finish()));

        assertInstanceOf(ArithmeticOverflowException.class, e.getCause());
        assertEquals(amount("6.0"), store.find(2).orElseThrow().getAvailable());
        assertEquals(Amount.ofScaled(Long.MAX_VALUE), store.find(1).orElseThrow().getAvailable());
    }

    @Test
    void finish_withoutDrainTimeout_waitsForLongBacklog() throws Exception {
        StreamLedgerEngine unbounded = new StreamLedgerEngine(vertx, store, new EngineConfig());
        for (long txId = 1; txId <= 20_000; txId++) {
            unbounded.process(TransactionRecord.deposit(1, txId, amount("0.0001")));
        }

        LedgerStore result = await(unbounded.finish());

        assertEquals(amount("2.0"), result.find(1).orElseThrow().getAvailable());
        assertEquals(20_000, result.find(1).orElseThrow().retainedTransactionCount());
    }

    @Test
    void abort_undeploysWorkersWithoutDraining() throws Exception {
        TransactionFixtures.clientMajor(4).forEach(engine::process);
        assertEquals(4, vertx.deploymentIDs().size());

        await(engine.abort());

        assertTrue(vertx.deploymentIDs().isEmpty());
        assertThrows(IllegalStateException.class, () -> engine.process(TransactionRecord.dispute(1, 1)));
        assertTrue(engine.abort().succeeded());
    }

    @Test
    void process_afterFinish_isRejected() throws Exception {
        await(engine.finish());

        assertThrows(IllegalStateException.class, () -> engine.process(TransactionRecord.dispute(1, 1)));
        assertTrue(engine.finish().failed());
        assertEquals(EngineType.STREAM, engine.type());
    }

    @Test
    void process_fromEventLoop_isRejected() throws Exception {
        AtomicReference<Throwable> error = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        vertx.runOnContext(v -> {
            try {
                engine.process(TransactionRecord.deposit(1, 1, amount("1.0")));
            } catch (IllegalStateException e) {
                error.set(e);
            }
            latch.countDown();
        });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.get());
    }

    static EngineConfig config() {
        EngineConfig config = new EngineConfig();
        config.setType(EngineType.STREAM.getValue());
        config.setWorkerDeployTimeoutMs(5_000);
        config.setDrainTimeoutMs(20_000);
        return config;
    }

    static <T> T await(Future<T> future) throws ExecutionException, InterruptedException, TimeoutException {
        return future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
    }

    private static Amount amount(String text) {
        return Amount.parse(text);
    }
}
