package com.txledger.domain.model;

/**
 * Kind of an input transaction
 */
public enum TransactionType {
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    DISPUTE("dispute"),
    RESOLVE("resolve"),
    CHARGEBACK("chargeback");

    private final String value;

    TransactionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Deposits and withdrawals carry an amount and are retained for later disputes
     */
    public boolean carriesAmount() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    public static TransactionType fromValue(String value) {
        for (TransactionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + value);
    }

    public static boolean isValid(String value) {
        for (TransactionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
