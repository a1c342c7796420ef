package com.delta.factengine.facts.fx;

import com.delta.factengine.facts.model.ExchangeRateEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable per-run view of directional exchange rates.
 *
 * <p>Only stored pairs (plus the built-in fallbacks) are known; no inverse or transitive rate is derived.
 */
public final class ExchangeRateTable {
    private static final Logger log = LoggerFactory.getLogger(ExchangeRateTable.class);

    static final Map<String, Double> DEFAULT_RATES = defaultRates();

    private final Map<String, ExchangeRateEntry> rates;
    private final Set<String> degradedPairs;
    private final String storageCurrency;
    private final String defaultSourceCurrency;

    private ExchangeRateTable(
        Map<String, ExchangeRateEntry> rates,
        Set<String> degradedPairs,
        String storageCurrency,
        String defaultSourceCurrency
    ) {
        this.rates = Collections.unmodifiableMap(rates);
        this.degradedPairs = Collections.unmodifiableSet(degradedPairs);
        this.storageCurrency = normalize(storageCurrency);
        this.defaultSourceCurrency = normalize(defaultSourceCurrency);
    }

    /**
     * Builds a table from stored rows. The row with the latest fetch date wins per pair, and any
     * default pair missing from the rows is filled with its fallback rate.
     */
    public static ExchangeRateTable fromEntries(
        Collection<ExchangeRateEntry> entries,
        String storageCurrency,
        String defaultSourceCurrency
    ) {
        Map<String, ExchangeRateEntry> latest = new HashMap<>();
        if (entries != null) {
            for (ExchangeRateEntry entry : entries) {
                if (entry == null || !Double.isFinite(entry.rate()) || entry.rate() <= 0) {
                    continue;
                }
                String key = pairKey(entry.fromCurrency(), entry.toCurrency());
                ExchangeRateEntry current = latest.get(key);
                if (current == null || isNewer(entry, current)) {
                    latest.put(key, entry);
                }
            }
        }

        Set<String> degraded = new LinkedHashSet<>();
        for (Map.Entry<String, Double> fallback : DEFAULT_RATES.entrySet()) {
            if (!latest.containsKey(fallback.getKey())) {
                String[] pair = fallback.getKey().split("->");
                latest.put(fallback.getKey(), new ExchangeRateEntry(pair[0], pair[1], fallback.getValue(), null));
                degraded.add(fallback.getKey());
            }
        }
        if (!degraded.isEmpty()) {
            log.warn("Exchange rates degraded: using fallback defaults for {}", degraded);
        }
        return new ExchangeRateTable(latest, degraded, storageCurrency, defaultSourceCurrency);
    }

    public Double rate(String fromCurrency, String toCurrency) {
        String from = normalize(fromCurrency);
        String to = normalize(toCurrency);
        if (from == null || to == null) {
            return null;
        }
        if (from.equals(to)) {
            return 1.0;
        }
        ExchangeRateEntry entry = rates.get(pairKey(from, to));
        return entry == null ? null : entry.rate();
    }

    /**
     * Converts {@code amount} into the storage currency. A missing currency is assumed to be the
     * default source currency. Returns null when no rate for the pair is known.
     *
     * @param context label for log messages, usually the ticker and field
     */
    public Double convert(Double amount, String fromCurrency, String context) {
        if (amount == null) {
            return null;
        }
        String from = normalize(fromCurrency);
        if (from == null) {
            log.warn("Currency missing for {}; assuming {}", context, defaultSourceCurrency);
            from = defaultSourceCurrency;
        }
        if (from.equals(storageCurrency)) {
            return amount;
        }
        Double rate = rate(from, storageCurrency);
        if (rate == null) {
            log.warn("Conversion failure for {}: no rate {} -> {}", context, from, storageCurrency);
            return null;
        }
        double converted = amount * rate;
        if (!Double.isFinite(converted)) {
            log.warn("Conversion failure for {}: non-finite result converting {} {}", context, amount, from);
            return null;
        }
        return converted;
    }

    public String storageCurrency() {
        return storageCurrency;
    }

    public String defaultSourceCurrency() {
        return defaultSourceCurrency;
    }

    public boolean isDegraded() {
        return !degradedPairs.isEmpty();
    }

    public Set<String> degradedPairs() {
        return degradedPairs;
    }

    public int size() {
        return rates.size();
    }

    private static boolean isNewer(ExchangeRateEntry candidate, ExchangeRateEntry current) {
        Instant candidateDate = candidate.fetchDate();
        Instant currentDate = current.fetchDate();
        if (candidateDate == null) {
            return false;
        }
        return currentDate == null || candidateDate.isAfter(currentDate);
    }

    private static String pairKey(String from, String to) {
        return normalize(from) + "->" + normalize(to);
    }

    private static String normalize(String currency) {
        if (currency == null || currency.isBlank()) {
            return null;
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }

    private static Map<String, Double> defaultRates() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put("CAD->USD", 0.73);
        defaults.put("USD->CAD", 1.37);
        defaults.put("AUD->USD", 0.66);
        return Collections.unmodifiableMap(defaults);
    }
}
