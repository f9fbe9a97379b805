package com.txledger.domain.model;

import com.txledger.domain.exception.ArithmeticOverflowException;
import lombok.Getter;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Account Ledger - balances and dispute history of a single client.
 *
 * <p>Not thread-safe. Exactly one thread (the serial engine, or the client's
 * stream worker) applies transactions to a ledger during a run.
 *
 * <p>Balance effects, with {@code d} the disputed delta of the referenced
 * transaction ({@code +amount} for a deposit, {@code -amount} for a withdrawal):
 * <ul>
 *   <li>dispute: available -= d, held += d</li>
 *   <li>resolve: held -= d, available += d</li>
 *   <li>chargeback: held -= d, account locked</li>
 * </ul>
 */
public class AccountLedger {

    @Getter
    private final int clientId;
    @Getter
    private Amount available = Amount.ZERO;
    @Getter
    private Amount held = Amount.ZERO;
    @Getter
    private boolean locked;

    private final Map<Long, DisputableTransaction> retained = new HashMap<>();

    public AccountLedger(int clientId) {
        this.clientId = clientId;
    }

    public Amount getTotal() {
        return available.add(held);
    }

    public Optional<DisputableTransaction> findTransaction(long txId) {
        return Optional.ofNullable(retained.get(txId));
    }

    public int retainedTransactionCount() {
        return retained.size();
    }

    /**
     * Apply one transaction.
     *
     * @return APPLIED, or the reason the transaction was dropped without effect
     * @throws ArithmeticOverflowException if a balance would overflow; the ledger is left unchanged
     * @throws IllegalArgumentException if the record belongs to another client
     */
    public ApplyOutcome apply(TransactionRecord record) {
        if (record.getClientId() != clientId) {
            throw new IllegalArgumentException(
                    "record for client " + record.getClientId() + " applied to ledger of client " + clientId);
        }
        if (locked) {
            return ApplyOutcome.ACCOUNT_LOCKED;
        }

        return switch (record.getType()) {
            case DEPOSIT -> deposit(record);
            case WITHDRAWAL -> withdraw(record);
            case DISPUTE -> dispute(record.getTxId());
            case RESOLVE -> resolve(record.getTxId());
            case CHARGEBACK -> chargeback(record.getTxId());
        };
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, getTotal(), locked);
    }

    private ApplyOutcome deposit(TransactionRecord record) {
        if (retained.containsKey(record.getTxId())) {
            return ApplyOutcome.DUPLICATE_TRANSACTION;
        }

        Amount newAvailable = available.add(record.getAmount());
        checkTotal(newAvailable, held);

        available = newAvailable;
        retain(record);
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome withdraw(TransactionRecord record) {
        if (retained.containsKey(record.getTxId())) {
            return ApplyOutcome.DUPLICATE_TRANSACTION;
        }
        if (!available.isSufficientFor(record.getAmount())) {
            return ApplyOutcome.INSUFFICIENT_FUNDS;
        }

        Amount newAvailable = available.subtract(record.getAmount());
        checkTotal(newAvailable, held);

        available = newAvailable;
        retain(record);
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome dispute(long txId) {
        DisputableTransaction entry = retained.get(txId);
        if (entry == null) {
            return ApplyOutcome.UNKNOWN_TRANSACTION;
        }
        if (!entry.getState().canBeDisputed()) {
            return ApplyOutcome.NOT_DISPUTABLE;
        }

        Amount delta = entry.disputedDelta();
        Amount newAvailable = available.subtract(delta);
        Amount newHeld = held.add(delta);
        checkTotal(newAvailable, newHeld);

        available = newAvailable;
        held = newHeld;
        entry.transitionTo(DisputeState.DISPUTED);
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome resolve(long txId) {
        DisputableTransaction entry = retained.get(txId);
        if (entry == null) {
            return ApplyOutcome.UNKNOWN_TRANSACTION;
        }
        if (!entry.getState().isDisputed()) {
            return ApplyOutcome.NOT_DISPUTED;
        }

        Amount delta = entry.disputedDelta();
        Amount newHeld = held.subtract(delta);
        Amount newAvailable = available.add(delta);
        checkTotal(newAvailable, newHeld);

        held = newHeld;
        available = newAvailable;
        entry.transitionTo(DisputeState.RESOLVED);
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome chargeback(long txId) {
        DisputableTransaction entry = retained.get(txId);
        if (entry == null) {
            return ApplyOutcome.UNKNOWN_TRANSACTION;
        }
        if (!entry.getState().isDisputed()) {
            return ApplyOutcome.NOT_DISPUTED;
        }

        Amount newHeld = held.subtract(entry.disputedDelta());
        checkTotal(available, newHeld);

        held = newHeld;
        locked = true;
        entry.transitionTo(DisputeState.CHARGED_BACK);
        return ApplyOutcome.APPLIED;
    }

    private void retain(TransactionRecord record) {
        retained.put(record.getTxId(),
                new DisputableTransaction(record.getTxId(), record.getType(), record.getAmount()));
    }

    // available + held must stay representable
    private static void checkTotal(Amount newAvailable, Amount newHeld) {
        newAvailable.add(newHeld);
    }
}
