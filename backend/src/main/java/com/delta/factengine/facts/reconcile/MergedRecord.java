package com.delta.factengine.facts.reconcile;

import com.delta.factengine.facts.field.FinancialField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciled field values with the source each one came from.
 */
public record MergedRecord(Map<FinancialField, SourcedValue> values, List<String> contributingSources) {
    public MergedRecord {
        EnumMap<FinancialField, SourcedValue> copy = new EnumMap<>(FinancialField.class);
        if (values != null) {
            copy.putAll(values);
        }
        values = Collections.unmodifiableMap(copy);
        contributingSources = contributingSources == null ? List.of() : List.copyOf(contributingSources);
    }

    public record SourcedValue(double value, String currency, String sourceId) {
    }

    public Double value(FinancialField field) {
        SourcedValue sourced = values.get(field);
        return sourced == null ? null : sourced.value();
    }

    public String sourceOf(FinancialField field) {
        SourcedValue sourced = values.get(field);
        return sourced == null ? null : sourced.sourceId();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
