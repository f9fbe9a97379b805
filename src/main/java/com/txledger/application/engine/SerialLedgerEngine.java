package com.txledger.application.engine;

import com.txledger.domain.model.AccountLedger;
import com.txledger.domain.model.ApplyOutcome;
import com.txledger.domain.model.LedgerStore;
import com.txledger.domain.model.TransactionRecord;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies transactions immediately on the calling thread, one at a time.
 * An arithmetic overflow propagates out of {@link #process} and aborts the run.
 */
@Slf4j
public class SerialLedgerEngine implements LedgerEngine {

    private final LedgerStore store;
    private long applied;
    private long dropped;
    private boolean finished;

    public SerialLedgerEngine(LedgerStore store) {
        this.store = store;
    }

    @Override
    public void process(TransactionRecord record) {
        if (finished) {
            throw new IllegalStateException("engine already finished");
        }

        log.debug("[Client {}] Processing transaction: {}", record.getClientId(), record);

        AccountLedger ledger = store.getOrCreate(record.getClientId());
        ApplyOutcome outcome = ledger.apply(record);
        if (outcome.isApplied()) {
            applied++;
        } else {
            dropped++;
            log.warn("[Client {}] {}; dropping transaction: {}",
                    record.getClientId(), outcome.getDescription(), record);
        }
    }

    @Override
    public Future<LedgerStore> finish() {
        finished = true;
        log.info("Serial engine finished: {} clients, {} transactions applied, {} dropped",
                store.size(), applied, dropped);
        return Future.succeededFuture(store);
    }

    @Override
    public Future<Void> abort() {
        finished = true;
        return Future.succeededFuture();
    }

    @Override
    public EngineType type() {
        return EngineType.SERIAL;
    }
}
