package com.txledger.application.engine;

import com.txledger.domain.model.AccountLedger;
import com.txledger.domain.model.LedgerStore;
import com.txledger.domain.model.TransactionRecord;
import com.txledger.infrastructure.config.EngineConfig;
import com.txledger.infrastructure.config.TransactionRecordCodec;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Streams transactions to client-partitioned workers.
 *
 * <p>The caller acts as dispatcher: for each record it looks up, or deploys on
 * first sight, the {@link ClientLedgerVerticle} owning that client's ledger and
 * sends the record to the worker's address. Event bus delivery from one sender
 * to one local consumer keeps send order, so each client sees its transactions
 * in input order. Clients never share state, so no ordering is needed across them.
 *
 * <p>Must be driven from a thread that is not a Vert.x event loop, since
 * deploying a worker blocks the dispatcher until the worker listens.
 *
 * <p>{@link #finish()} waits for every worker to apply its backlog. With a
 * positive {@code drain-timeout-ms} the wait is bounded and a slower drain
 * fails the run with a {@link TimeoutException}; the default of 0 waits
 * indefinitely.
 */
@Slf4j
public class StreamLedgerEngine implements LedgerEngine {

    private final Vertx vertx;
    private final LedgerStore store;
    private final long deployTimeoutMs;
    private final long drainTimeoutMs;
    private final Map<Integer, Worker> workers = new LinkedHashMap<>();
    private long dispatched;
    private boolean finished;

    public StreamLedgerEngine(Vertx vertx, LedgerStore store, EngineConfig config) {
        this.vertx = vertx;
        this.store = store;
        this.deployTimeoutMs = config.getWorkerDeployTimeoutMs();
        this.drainTimeoutMs = config.getDrainTimeoutMs();
        TransactionRecordCodec.register(vertx.eventBus());
    }

    @Override
    public void process(TransactionRecord record) {
        if (finished) {
            throw new IllegalStateException("engine already finished");
        }

        Worker worker = workerFor(record.getClientId());
        log.debug("[Client {}] Enqueueing transaction: {}", record.getClientId(), record);
        vertx.eventBus().send(worker.address(), record);
        dispatched++;
    }

    @Override
    public Future<LedgerStore> finish() {
        if (finished) {
            return Future.failedFuture(new IllegalStateException("engine already finished"));
        }
        finished = true;

        log.info("End of input after {} transactions; waiting for {} workers to drain", dispatched, workers.size());

        EventBus eventBus = vertx.eventBus();
        DeliveryOptions endOfInput = new DeliveryOptions()
                .addHeader(ClientLedgerVerticle.ACTION_HEADER, ClientLedgerVerticle.END_OF_INPUT);

        List<Future<JsonObject>> drains = new ArrayList<>(workers.size());
        for (Worker worker : workers.values()) {
            eventBus.send(worker.address(), null, endOfInput);
            drains.add(worker.verticle().drained()
                    .onSuccess(summary -> log.debug("[Client {}] worker drained: {}", worker.clientId(), summary)));
        }

        return withDrainTimeout(Future.join(drains).mapEmpty())
                .transform(drained -> undeployAll().transform(undeployed -> drained.succeeded()
                        ? Future.succeededFuture(store)
                        : Future.<LedgerStore>failedFuture(drained.cause())))
                .onSuccess(s -> log.info("Stream engine finished: {} clients", s.size()))
                .onFailure(error -> log.error("Stream engine failed: {}", error.getMessage()));
    }

    @Override
    public Future<Void> abort() {
        if (finished) {
            return Future.succeededFuture();
        }
        finished = true;

        log.warn("Aborting after {} transactions; undeploying {} workers", dispatched, workers.size());
        return undeployAll();
    }

    @Override
    public EngineType type() {
        return EngineType.STREAM;
    }

    /**
     * Bound the wait for all workers when a drain timeout is configured; 0 waits indefinitely
     */
    private Future<Void> withDrainTimeout(Future<Void> drains) {
        if (drainTimeoutMs <= 0) {
            return drains;
        }

        Promise<Void> bounded = Promise.promise();
        long timerId = vertx.setTimer(drainTimeoutMs, id -> bounded.tryFail(
                new TimeoutException("workers did not drain within " + drainTimeoutMs + " ms")));
        drains.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                bounded.tryComplete();
            } else {
                bounded.tryFail(ar.cause());
            }
        });
        return bounded.future();
    }

    private Future<Void> undeployAll() {
        List<Future<Void>> undeployments = new ArrayList<>(workers.size());
        for (Worker worker : workers.values()) {
            undeployments.add(vertx.undeploy(worker.deploymentId())
                    .onFailure(error -> log.warn("[Client {}] failed to undeploy worker: {}",
                            worker.clientId(), error.getMessage())));
        }
        return Future.join(undeployments).mapEmpty();
    }

    private Worker workerFor(int clientId) {
        Worker worker = workers.get(clientId);
        if (worker != null) {
            return worker;
        }

        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("stream engine must not be driven from an event loop thread");
        }

        AccountLedger ledger = store.getOrCreate(clientId);
        ClientLedgerVerticle verticle = new ClientLedgerVerticle(ledger);

        log.info("[Client {}] spawning worker", clientId);
        String deploymentId = await(vertx.deployVerticle(verticle), deployTimeoutMs, "deploy worker for client " + clientId);

        worker = new Worker(clientId, ClientLedgerVerticle.addressOf(clientId), deploymentId, verticle);
        workers.put(clientId, worker);
        return worker;
    }

    private static <T> T await(Future<T> future, long timeoutMs, String action) {
        try {
            return future.toCompletionStage().toCompletableFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to " + action, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to " + action, e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out after " + timeoutMs + " ms waiting to " + action, e);
        }
    }

    private record Worker(int clientId, String address, String deploymentId, ClientLedgerVerticle verticle) {}
}
