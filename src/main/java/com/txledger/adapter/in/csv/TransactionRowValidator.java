package com.txledger.adapter.in.csv;

import com.txledger.domain.model.TransactionRecord;
import com.txledger.domain.model.TransactionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates raw input rows field by field.
 * Amount precision and range are checked later, by Amount itself.
 */
public class TransactionRowValidator {

    /**
     * Validate a raw transaction row
     */
    public ValidationResult validate(TransactionRow row) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(row, errors);
        validateEnumValues(row, errors);
        validateIdentifiers(row, errors);
        validateAmountPresence(row, errors);

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(errors);
        }
    }

    private void validateRequiredFields(TransactionRow row, List<String> errors) {
        if (isBlank(row.getType())) {
            errors.add("type is required");
        }
        if (isBlank(row.getClient())) {
            errors.add("client is required");
        }
        if (isBlank(row.getTx())) {
            errors.add("tx is required");
        }
    }

    private void validateEnumValues(TransactionRow row, List<String> errors) {
        if (!isBlank(row.getType()) && !TransactionType.isValid(row.getType().trim())) {
            errors.add("type must be one of: deposit, withdrawal, dispute, resolve, chargeback (got " + row.getType() + ")");
        }
    }

    private void validateIdentifiers(TransactionRow row, List<String> errors) {
        if (!isBlank(row.getClient()) && parseInRange(row.getClient(), TransactionRecord.MAX_CLIENT_ID) == null) {
            errors.add("client must be an integer between 0 and " + TransactionRecord.MAX_CLIENT_ID + " (got " + row.getClient() + ")");
        }
        if (!isBlank(row.getTx()) && parseInRange(row.getTx(), TransactionRecord.MAX_TX_ID) == null) {
            errors.add("tx must be an integer between 0 and " + TransactionRecord.MAX_TX_ID + " (got " + row.getTx() + ")");
        }
    }

    private void validateAmountPresence(TransactionRow row, List<String> errors) {
        if (isBlank(row.getType()) || !TransactionType.isValid(row.getType().trim())) {
            return;
        }
        TransactionType type = TransactionType.fromValue(row.getType().trim());
        if (type.carriesAmount() && isBlank(row.getAmount())) {
            errors.add("amount is required for " + type.getValue());
        }
    }

    /**
     * Parse a non-negative integer no larger than max, or null if it is not one
     */
    static Long parseInRange(String text, long max) {
        try {
            long value = Long.parseLong(text.trim());
            return value >= 0 && value <= max ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
