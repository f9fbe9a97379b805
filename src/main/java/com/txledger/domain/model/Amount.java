package com.txledger.domain.model;

import com.txledger.domain.exception.ArithmeticOverflowException;
import com.txledger.domain.exception.TransactionParseException;
import com.txledger.domain.exception.TransactionParseException.Reason;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;

/**
 * Monetary amount - signed fixed-point value with exactly 4 fractional digits.
 * Stored as a long scaled by 10,000; all arithmetic is overflow-checked.
 */
@EqualsAndHashCode
public final class Amount implements Comparable<Amount> {

    public static final int MAX_FRACTION_DIGITS = 4;
    public static final long SCALE = 10_000L;

    public static final Amount ZERO = new Amount(0);

    private final long scaled;

    private Amount(long scaled) {
        this.scaled = scaled;
    }

    public static Amount ofScaled(long scaled) {
        return scaled == 0 ? ZERO : new Amount(scaled);
    }

    /**
     * Decode a decimal string such as "12.3456".
     * Trailing zeros beyond the fourth fractional digit are tolerated ("1.50000").
     *
     * @throws TransactionParseException PRECISION_EXCEEDED, OVERFLOW or INVALID_AMOUNT
     */
    public static Amount parse(String text) {
        if (text == null || text.isBlank()) {
            throw new TransactionParseException(Reason.INVALID_AMOUNT, "amount is required");
        }

        BigDecimal decimal;
        try {
            decimal = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new TransactionParseException(Reason.INVALID_AMOUNT, "amount is not a decimal number: " + text, e);
        }

        BigDecimal normalized = decimal.stripTrailingZeros();
        if (normalized.scale() > MAX_FRACTION_DIGITS) {
            throw new TransactionParseException(Reason.PRECISION_EXCEEDED,
                    "amount has more than " + MAX_FRACTION_DIGITS + " fractional digits: " + text);
        }

        try {
            return ofScaled(normalized.movePointRight(MAX_FRACTION_DIGITS).longValueExact());
        } catch (ArithmeticException e) {
            throw new TransactionParseException(Reason.OVERFLOW, "amount exceeds the representable range: " + text, e);
        }
    }

    public long scaledValue() {
        return scaled;
    }

    public Amount add(Amount other) {
        try {
            return ofScaled(Math.addExact(scaled, other.scaled));
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException("overflow adding " + other + " to " + this);
        }
    }

    public Amount subtract(Amount other) {
        try {
            return ofScaled(Math.subtractExact(scaled, other.scaled));
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException("overflow subtracting " + other + " from " + this);
        }
    }

    public Amount negate() {
        try {
            return ofScaled(Math.negateExact(scaled));
        } catch (ArithmeticException e) {
            throw new ArithmeticOverflowException("overflow negating " + this);
        }
    }

    /**
     * Withdrawal admission check: this balance covers the given amount
     */
    public boolean isSufficientFor(Amount amount) {
        return scaled >= amount.scaled;
    }

    public boolean isNegative() {
        return scaled < 0;
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(scaled, MAX_FRACTION_DIGITS);
    }

    /**
     * Plain rendering with trailing zeros removed but at least one fractional digit, e.g. "7.0", "0.0001"
     */
    public String toPlainString() {
        BigDecimal stripped = toBigDecimal().stripTrailingZeros();
        if (stripped.scale() < 1) {
            stripped = stripped.setScale(1);
        }
        return stripped.toPlainString();
    }

    @Override
    public int compareTo(Amount other) {
        return Long.compare(scaled, other.scaled);
    }

    @Override
    public String toString() {
        return toPlainString();
    }
}
