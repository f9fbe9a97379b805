package com.txledger.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A deposit or withdrawal retained by an account for later dispute actions.
 * Only the account's state machine moves it between dispute states.
 */
@Getter
@ToString
public class DisputableTransaction {
    private final long txId;
    private final TransactionType type;
    private final Amount amount;
    private DisputeState state = DisputeState.NONE;

    DisputableTransaction(long txId, TransactionType type, Amount amount) {
        this.txId = txId;
        this.type = type;
        this.amount = amount;
    }

    /**
     * Amount a dispute moves from available into held.
     * Positive for a deposit; negated for a withdrawal, which reverses money that left the account.
     */
    Amount disputedDelta() {
        return type == TransactionType.WITHDRAWAL ? amount.negate() : amount;
    }

    void transitionTo(DisputeState next) {
        this.state = next;
    }
}
