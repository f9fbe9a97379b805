package com.txledger.adapter.out.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.txledger.domain.model.AccountSnapshot;

/**
 * Output row, amounts rendered with at most 4 fractional digits
 */
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public record SnapshotRow(int client, String available, String held, String total, boolean locked) {

    public static SnapshotRow from(AccountSnapshot snapshot) {
        return new SnapshotRow(
                snapshot.getClient(),
                snapshot.getAvailable().toPlainString(),
                snapshot.getHeld().toPlainString(),
                snapshot.getTotal().toPlainString(),
                snapshot.isLocked()
        );
    }
}
