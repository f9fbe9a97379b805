package com.txledger.adapter.in.csv;

import com.txledger.domain.exception.TransactionParseException;
import com.txledger.domain.model.Amount;
import com.txledger.domain.model.TransactionRecord;
import com.txledger.domain.model.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts validated raw rows into TransactionRecords
 */
@Slf4j
@RequiredArgsConstructor
public class TransactionRowMapper {

    private final TransactionRowValidator validator;

    /**
     * @param row       raw row
     * @param rowNumber 1-based data row number, used in error messages
     * @throws TransactionParseException if the row is malformed or its amount invalid
     */
    public TransactionRecord toRecord(TransactionRow row, long rowNumber) {
        ValidationResult validation = validator.validate(row);
        if (!validation.isValid()) {
            log.warn("Validation failed for row {}: {}", rowNumber, validation.errors());
            throw TransactionParseException.malformed(rowNumber, validation.describe());
        }

        TransactionType type = TransactionType.fromValue(row.getType().trim());
        int clientId = TransactionRowValidator.parseInRange(row.getClient(), TransactionRecord.MAX_CLIENT_ID).intValue();
        long txId = TransactionRowValidator.parseInRange(row.getTx(), TransactionRecord.MAX_TX_ID);

        Amount amount = null;
        if (type.carriesAmount()) {
            amount = parseAmount(row.getAmount(), rowNumber);
        } else if (!TransactionRowValidator.isBlank(row.getAmount())) {
            log.debug("Ignoring amount '{}' on {} row {}", row.getAmount(), type.getValue(), rowNumber);
        }

        return TransactionRecord.of(type, clientId, txId, amount);
    }

    private Amount parseAmount(String text, long rowNumber) {
        Amount amount;
        try {
            amount = Amount.parse(text);
        } catch (TransactionParseException e) {
            throw e.atRow(rowNumber);
        }
        if (amount.isNegative()) {
            throw TransactionParseException.malformed(rowNumber, "amount must be non-negative (got " + text + ")");
        }
        return amount;
    }
}
