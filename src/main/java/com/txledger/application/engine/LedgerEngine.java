package com.txledger.application.engine;

import com.txledger.domain.model.LedgerStore;
import com.txledger.domain.model.TransactionRecord;
import io.vertx.core.Future;

/**
 * Applies an ordered transaction stream to a LedgerStore.
 * Implementations must yield the same final store for the same input.
 */
public interface LedgerEngine {

    /**
     * Accept the next transaction in input order
     * @throws com.txledger.domain.exception.ArithmeticOverflowException if the engine applies synchronously and a balance overflows
     * @throws IllegalStateException after {@link #finish()}
     */
    void process(TransactionRecord record);

    /**
     * Signal end of input and wait until every transaction has been applied
     * @return Future with the populated store, failed if any transaction overflowed
     */
    Future<LedgerStore> finish();

    /**
     * Stop after a failed dispatch without waiting for pending transactions.
     * Releases whatever the engine started; a no-op once finished.
     */
    Future<Void> abort();

    EngineType type();
}
