package com.txledger.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Validated input transaction.
 * The amount is present exactly for deposits and withdrawals.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long txId;
    Amount amount;  // null for dispute, resolve and chargeback

    public static TransactionRecord of(TransactionType type, int clientId, long txId, Amount amount) {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("client id out of range: " + clientId);
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new IllegalArgumentException("tx id out of range: " + txId);
        }
        if (type.carriesAmount() && amount == null) {
            throw new IllegalArgumentException(type.getValue() + " requires an amount");
        }
        return new TransactionRecord(type, clientId, txId, type.carriesAmount() ? amount : null);
    }

    public static TransactionRecord deposit(int clientId, long txId, Amount amount) {
        return of(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static TransactionRecord withdrawal(int clientId, long txId, Amount amount) {
        return of(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static TransactionRecord dispute(int clientId, long txId) {
        return of(TransactionType.DISPUTE, clientId, txId, null);
    }

    public static TransactionRecord resolve(int clientId, long txId) {
        return of(TransactionType.RESOLVE, clientId, txId, null);
    }

    public static TransactionRecord chargeback(int clientId, long txId) {
        return of(TransactionType.CHARGEBACK, clientId, txId, null);
    }

    public boolean hasAmount() {
        return amount != null;
    }
}
