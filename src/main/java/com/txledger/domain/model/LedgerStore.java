package com.txledger.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Owner of every client's AccountLedger for one run.
 *
 * <p>Ledgers are created lazily on the first transaction of a client. The map
 * itself is only touched by the thread driving the run; the serial engine
 * mutates ledgers on that same thread, the stream engine hands each ledger to
 * exactly one worker.
 */
public class LedgerStore {

    private final Map<Integer, AccountLedger> ledgers = new TreeMap<>();

    public AccountLedger getOrCreate(int clientId) {
        return ledgers.computeIfAbsent(clientId, AccountLedger::new);
    }

    public Optional<AccountLedger> find(int clientId) {
        return Optional.ofNullable(ledgers.get(clientId));
    }

    public boolean contains(int clientId) {
        return ledgers.containsKey(clientId);
    }

    public int size() {
        return ledgers.size();
    }

    /**
     * Snapshots of all ledgers, ordered by ascending client id
     */
    public List<AccountSnapshot> snapshots() {
        List<AccountSnapshot> snapshots = new ArrayList<>(ledgers.size());
        for (AccountLedger ledger : ledgers.values()) {
            snapshots.add(ledger.snapshot());
        }
        return snapshots;
    }
}
