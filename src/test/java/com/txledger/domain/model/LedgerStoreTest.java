package com.txledger.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LedgerStore
 */
class LedgerStoreTest {

    @Test
    void getOrCreate_createsEmptyLedgerOnce() {
        LedgerStore store = new LedgerStore();

        AccountLedger first = store.getOrCreate(3);
        AccountLedger second = store.getOrCreate(3);

        assertSame(first, second);
        assertEquals(1, store.size());
        assertEquals(Amount.ZERO, first.getAvailable());
        assertFalse(first.isLocked());
    }

    @Test
    void find_doesNotCreate() {
        LedgerStore store = new LedgerStore();

        assertTrue(store.find(1).isEmpty());
        assertFalse(store.contains(1));
        assertEquals(0, store.size());
    }

    @Test
    void snapshots_areOrderedByClientId() {
        LedgerStore store = new LedgerStore();
        store.getOrCreate(9).apply(TransactionRecord.deposit(9, 1, Amount.parse("1.0")));
        store.getOrCreate(2).apply(TransactionRecord.deposit(2, 2, Amount.parse("2.0")));
        store.getOrCreate(5);

        List<AccountSnapshot> snapshots = store.snapshots();

        assertEquals(List.of(2, 5, 9), snapshots.stream().map(AccountSnapshot::getClient).toList());
        assertEquals(Amount.parse("2.0"), snapshots.get(0).getTotal());
        assertEquals(Amount.ZERO, snapshots.get(1).getTotal());
    }
}
