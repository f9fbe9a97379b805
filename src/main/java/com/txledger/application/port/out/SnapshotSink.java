package com.txledger.application.port.out;

import com.txledger.domain.model.AccountSnapshot;
import io.vertx.core.Future;

import java.util.List;

/**
 * Output port receiving the final per-client snapshots of a successful run
 */
public interface SnapshotSink {

    /**
     * Write all snapshots
     * @param snapshots One snapshot per client, ordered by client id
     * @return Future completing once everything is written
     */
    Future<Void> accept(List<AccountSnapshot> snapshots);
}
