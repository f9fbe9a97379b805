package com.txledger.domain.model;

import lombok.Value;

/**
 * Final balance view of one client
 */
@Value
public class AccountSnapshot {
    int client;
    Amount available;
    Amount held;
    Amount total;  // available + held
    boolean locked;
}
