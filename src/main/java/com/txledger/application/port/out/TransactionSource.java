package com.txledger.application.port.out;

import com.txledger.domain.model.TransactionRecord;

import java.io.Closeable;

/**
 * Output port supplying the ordered input transactions.
 * Part of hexagonal architecture - the application drives it, adapters implement it.
 *
 * <p>Iteration is lazy and single-pass. Decoding failures surface as
 * {@link com.txledger.domain.exception.TransactionParseException} from the iterator.
 */
public interface TransactionSource extends Iterable<TransactionRecord>, Closeable {
}
