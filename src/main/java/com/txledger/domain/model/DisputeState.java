package com.txledger.domain.model;

/**
 * Dispute lifecycle of a retained deposit or withdrawal.
 * NONE -> DISPUTED -> {RESOLVED, CHARGED_BACK}; RESOLVED may be disputed again.
 */
public enum DisputeState {
    NONE,
    DISPUTED,
    RESOLVED,
    CHARGED_BACK;

    public boolean canBeDisputed() {
        return this == NONE || this == RESOLVED;
    }

    public boolean isDisputed() {
        return this == DISPUTED;
    }
}
