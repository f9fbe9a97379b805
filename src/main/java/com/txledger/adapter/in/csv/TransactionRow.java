package com.txledger.adapter.in.csv;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One raw input row, as text, before validation
 */
@Data
@AllArgsConstructor
public class TransactionRow {

    private String type;
    private String client;
    private String tx;
    private String amount;  // absent or empty for dispute, resolve and chargeback
}
