package com.delta.factengine.facts.model;

import com.delta.factengine.facts.field.FinancialField;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record FinancialSnapshot(
    long companyId,
    Map<FinancialField, FieldValue> fields,
    Instant lastUpdated,
    String dataSource
) {
    public FinancialSnapshot {
        EnumMap<FinancialField, FieldValue> copy = new EnumMap<>(FinancialField.class);
        if (fields != null) {
            fields.forEach((field, value) -> {
                if (value != null) {
                    copy.put(field, value);
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public FieldValue field(FinancialField field) {
        return fields.get(field);
    }

    public Double value(FinancialField field) {
        FieldValue value = fields.get(field);
        return value == null ? null : value.value();
    }
}
