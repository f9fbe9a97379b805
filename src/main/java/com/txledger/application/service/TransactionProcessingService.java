package com.txledger.application.service;

import com.txledger.application.engine.LedgerEngine;
import com.txledger.application.port.in.TransactionProcessingUseCase;
import com.txledger.application.port.out.SnapshotSink;
import com.txledger.application.port.out.TransactionSource;
import com.txledger.domain.model.AccountSnapshot;
import com.txledger.domain.model.LedgerStore;
import com.txledger.domain.model.TransactionRecord;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Application service implementing a processing run:
 * source -> engine -> store -> sink.
 * The sink is only invoked when every transaction was applied without a fatal error.
 */
@Slf4j
@RequiredArgsConstructor
public class TransactionProcessingService implements TransactionProcessingUseCase {

    private final LedgerEngine engine;
    private final SnapshotSink sink;

    @Override
    public Future<List<AccountSnapshot>> process(TransactionSource source) {
        log.info("Processing transactions with {} engine", engine.type().getValue());

        long count = 0;
        try {
            for (TransactionRecord record : source) {
                engine.process(record);
                count++;
            }
        } catch (RuntimeException e) {
            log.error("Aborting run after {} transactions: {}", count, e.getMessage());
            return engine.abort()
                    .onFailure(error -> log.warn("Engine did not shut down cleanly: {}", error.getMessage()))
                    .transform(ar -> Future.<List<AccountSnapshot>>failedFuture(e));
        }

        long total = count;
        return engine.finish()
                .map(LedgerStore::snapshots)
                .compose(snapshots -> sink.accept(snapshots).map(snapshots))
                .onSuccess(snapshots -> log.info("Processed {} transactions for {} clients", total, snapshots.size()))
                .onFailure(error -> log.error("Run failed: {}", error.getMessage()));
    }
}
