package com.txledger.domain.exception;

import lombok.Getter;

/**
 * Raised when an input row cannot be decoded into a valid transaction.
 * Always fatal: the run is aborted and no snapshot is written.
 */
@Getter
public class TransactionParseException extends IllegalArgumentException {

    public enum Reason {
        PRECISION_EXCEEDED,
        OVERFLOW,
        INVALID_AMOUNT,
        MALFORMED_ROW
    }

    private final Reason reason;
    private final String detail;
    private final long rowNumber;  // 1-based data row, 0 when unknown

    public TransactionParseException(Reason reason, String detail) {
        this(reason, detail, 0, null);
    }

    public TransactionParseException(Reason reason, String detail, Throwable cause) {
        this(reason, detail, 0, cause);
    }

    private TransactionParseException(Reason reason, String detail, long rowNumber, Throwable cause) {
        super(rowNumber > 0 ? "row " + rowNumber + ": " + detail : detail, cause);
        this.reason = reason;
        this.detail = detail;
        this.rowNumber = rowNumber;
    }

    /**
     * Copy of this exception tagged with the data row it was raised for
     */
    public TransactionParseException atRow(long rowNumber) {
        return new TransactionParseException(reason, detail, rowNumber, getCause());
    }

    public static TransactionParseException malformed(long rowNumber, String detail) {
        return new TransactionParseException(Reason.MALFORMED_ROW, detail, rowNumber, null);
    }
}
