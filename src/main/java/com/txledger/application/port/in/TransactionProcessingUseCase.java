package com.txledger.application.port.in;

import com.txledger.application.port.out.TransactionSource;
import com.txledger.domain.model.AccountSnapshot;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for a processing run
 * Defines the contract for turning a transaction stream into client snapshots
 */
public interface TransactionProcessingUseCase {

    /**
     * Apply every transaction of the source and hand the resulting snapshots to the sink
     * @param source The ordered transaction stream, consumed once
     * @return Future with the snapshots written, failed on a parse error or arithmetic overflow
     */
    Future<List<AccountSnapshot>> process(TransactionSource source);
}
