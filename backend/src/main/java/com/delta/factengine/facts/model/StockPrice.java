package com.delta.factengine.facts.model;

import java.time.LocalDate;

public record StockPrice(
    long companyId,
    LocalDate priceDate,
    double value,
    String currency
) {
}
