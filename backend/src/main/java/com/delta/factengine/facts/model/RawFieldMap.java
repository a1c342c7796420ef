package com.delta.factengine.facts.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RawFieldMap(
    String sourceId,
    Map<String, Object> values,
    String currencyHint,
    Instant fetchedAt
) {
    /**
     * Key under which a source reports the current share price. It is not a snapshot field.
     */
    public static final String STOCK_PRICE_KEY = "stock_price";

    public RawFieldMap {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean isEmpty() {
        return values.values().stream().allMatch(value -> value == null);
    }
}
