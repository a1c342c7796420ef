package com.delta.factengine.facts.model;

import java.time.Instant;

public record ExchangeRateEntry(
    String fromCurrency,
    String toCurrency,
    double rate,
    Instant fetchDate
) {
}
