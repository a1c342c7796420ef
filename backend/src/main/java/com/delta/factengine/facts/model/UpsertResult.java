package com.delta.factengine.facts.model;

import com.delta.factengine.facts.field.FinancialField;

import java.util.Set;

public record UpsertResult(
    UpsertOutcome outcome,
    String reason,
    Set<FinancialField> writtenFields
) {
    public static final String REASON_FRESH = "fresh";
    public static final String REASON_NO_VALID_DATA = "no_valid_data";

    public static UpsertResult skipped(String reason) {
        return new UpsertResult(UpsertOutcome.SKIPPED, reason, Set.of());
    }

    public boolean wrote() {
        return outcome != UpsertOutcome.SKIPPED;
    }
}
