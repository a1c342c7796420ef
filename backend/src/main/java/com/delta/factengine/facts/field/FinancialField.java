package com.delta.factengine.facts.field;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Field vocabulary shared by the sanitizer, the reconciler and the snapshot upsert.
 *
 * <p>Each constant names the raw key collaborators use, the storage column, whether the value is a
 * money amount (and therefore has a {@code <base>_currency} sibling column), and the minimum
 * magnitude below which a fetched value is treated as a scraping artifact.
 */
public enum FinancialField {
    MARKET_CAP("market_cap_value", true, 1_000_000d),
    ENTERPRISE_VALUE("enterprise_value_value", true, null),
    REVENUE("revenue_value", true, null),
    NET_INCOME("net_income_value", true, null),
    CASH("cash_value", true, null),
    DEBT("debt_value", true, null),
    LIABILITIES("liabilities", true, null),
    EBITDA("ebitda", true, null),
    FREE_CASH_FLOW("free_cash_flow", true, null),
    OPERATING_INCOME("operating_income", true, null),
    GROSS_PROFIT("gross_profit", true, null),
    SHARES_OUTSTANDING("shares_outstanding", false, 1_000_000d),
    TRAILING_PE("trailing_pe", false, null),
    FORWARD_PE("forward_pe", false, null),
    PRICE_TO_SALES("price_to_sales", false, null),
    PRICE_TO_BOOK("price_to_book", false, null);

    private static final Map<String, FinancialField> BY_KEY = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(FinancialField::key, Function.identity()));

    private final String key;
    private final boolean monetary;
    private final Double minimumPlausible;

    FinancialField(String key, boolean monetary, Double minimumPlausible) {
        this.key = key;
        this.monetary = monetary;
        this.minimumPlausible = minimumPlausible;
    }

    public String key() {
        return key;
    }

    public String column() {
        return key;
    }

    public boolean isMonetary() {
        return monetary;
    }

    public String currencyColumn() {
        if (!monetary) {
            return null;
        }
        String base = key.endsWith("_value") ? key.substring(0, key.length() - "_value".length()) : key;
        return base + "_currency";
    }

    public Double minimumPlausible() {
        return minimumPlausible;
    }

    public boolean isPlausible(double value) {
        if (!Double.isFinite(value)) {
            return false;
        }
        return minimumPlausible == null || value >= minimumPlausible;
    }

    public static Optional<FinancialField> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEY.get(key.trim().toLowerCase(Locale.ROOT)));
    }

    public static List<FinancialField> monetaryFields() {
        return Arrays.stream(values()).filter(FinancialField::isMonetary).toList();
    }
}
