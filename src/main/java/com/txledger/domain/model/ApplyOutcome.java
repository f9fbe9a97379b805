package com.txledger.domain.model;

/**
 * Result of applying one transaction to an account.
 * Everything but APPLIED is a silent no-op: the transaction is dropped.
 */
public enum ApplyOutcome {
    APPLIED("applied"),
    ACCOUNT_LOCKED("account is locked"),
    INSUFFICIENT_FUNDS("insufficient funds"),
    DUPLICATE_TRANSACTION("transaction id already used by this account"),
    UNKNOWN_TRANSACTION("no deposit/withdrawal with this id on this account"),
    NOT_DISPUTABLE("transaction is already disputed or charged back"),
    NOT_DISPUTED("transaction is not under dispute");

    private final String description;

    ApplyOutcome(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isApplied() {
        return this == APPLIED;
    }
}
