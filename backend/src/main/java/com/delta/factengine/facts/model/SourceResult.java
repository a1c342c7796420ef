package com.delta.factengine.facts.model;

import com.delta.factengine.facts.field.FinancialField;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record SourceResult(
    String sourceId,
    int priority,
    Map<FinancialField, Double> values,
    String currency,
    Instant fetchedAt
) {
    public SourceResult {
        EnumMap<FinancialField, Double> copy = new EnumMap<>(FinancialField.class);
        if (values != null) {
            copy.putAll(values);
        }
        values = Collections.unmodifiableMap(copy);
    }

    public Double value(FinancialField field) {
        return values.get(field);
    }
}
