package com.txledger.adapter.in.csv;

import java.util.Collections;
import java.util.List;

/**
 * Result of validating one input row
 */
public record ValidationResult(boolean isValid, List<String> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public String describe() {
        return String.join("; ", errors);
    }

    public static ValidationResult valid() {
        return new ValidationResult(true, Collections.emptyList());
    }

    public static ValidationResult invalid(List<String> errors) {
        return new ValidationResult(false, Collections.unmodifiableList(errors));
    }
}
