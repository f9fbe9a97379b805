package com.txledger.domain.exception;

/**
 * A balance update would leave the range of the scaled amount representation.
 * Fatal for the whole run.
 */
public class ArithmeticOverflowException extends ArithmeticException {

    public ArithmeticOverflowException(String message) {
        super(message);
    }
}
