package com.txledger.application.engine;

import com.txledger.domain.exception.ArithmeticOverflowException;
import com.txledger.domain.model.AccountLedger;
import com.txledger.domain.model.ApplyOutcome;
import com.txledger.domain.model.TransactionRecord;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-threaded worker owning the ledger of one client.
 * Every message is handled on the verticle's own context, in arrival order,
 * so the ledger needs no locking.
 *
 * <p>Records arrive on {@link #addressOf(int)}. A message carrying the
 * end-of-input header completes {@link #drained()} once everything sent before
 * it has been applied: with a summary on success, or with the overflow that
 * stopped the worker.
 */
@Slf4j
public class ClientLedgerVerticle extends AbstractVerticle {

    public static final String ADDRESS_PREFIX = "ledger.client.";
    public static final String ACTION_HEADER = "action";
    public static final String END_OF_INPUT = "end-of-input";

    private final AccountLedger ledger;
    private final Promise<JsonObject> drained = Promise.promise();
    private MessageConsumer<TransactionRecord> consumer;

    private ArithmeticOverflowException failure;
    private long received;
    private long applied;

    public ClientLedgerVerticle(AccountLedger ledger) {
        this.ledger = ledger;
    }

    public static String addressOf(int clientId) {
        return ADDRESS_PREFIX + clientId;
    }

    public int clientId() {
        return ledger.getClientId();
    }

    /**
     * Completes after the end-of-input marker has been handled
     */
    public Future<JsonObject> drained() {
        return drained.future();
    }

    @Override
    public void start(Promise<Void> startPromise) {
        consumer = vertx.eventBus().localConsumer(addressOf(clientId()), this::handle);
        consumer.completionHandler(ar -> {
            if (ar.succeeded()) {
                log.debug("[Client {}] worker listening on {}", clientId(), consumer.address());
            }
            startPromise.handle(ar);
        });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (consumer == null) {
            stopPromise.complete();
            return;
        }
        consumer.unregister().onComplete(stopPromise);
    }

    private void handle(Message<TransactionRecord> message) {
        if (END_OF_INPUT.equals(message.headers().get(ACTION_HEADER))) {
            endOfInput();
            return;
        }

        TransactionRecord record = message.body();
        received++;

        if (failure != null) {
            log.debug("[Client {}] worker failed earlier; ignoring transaction: {}", clientId(), record);
            return;
        }

        log.debug("[Client {}] Processing transaction: {}", clientId(), record);
        try {
            ApplyOutcome outcome = ledger.apply(record);
            if (outcome.isApplied()) {
                applied++;
            } else {
                log.warn("[Client {}] {}; dropping transaction: {}", clientId(), outcome.getDescription(), record);
            }
        } catch (ArithmeticOverflowException e) {
            failure = e;
            log.error("[Client {}] arithmetic overflow on transaction {}: {}", clientId(), record, e.getMessage());
        }
    }

    private void endOfInput() {
        if (failure != null) {
            drained.tryFail(failure);
            return;
        }

        log.debug("[Client {}] drained {} transactions ({} applied)", clientId(), received, applied);
        drained.tryComplete(new JsonObject()
                .put("client", clientId())
                .put("received", received)
                .put("applied", applied));
    }
}
