package com.delta.factengine.facts.fx;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.http.FetchTerminalException;
import com.delta.factengine.facts.http.PoliteHttpClient;
import com.delta.factengine.facts.model.ExchangeRateEntry;
import com.delta.factengine.facts.persistence.FinancialsJdbcRepository;
import com.delta.factengine.facts.retry.RetryExecutor;
import com.delta.factengine.facts.retry.RetryPolicy;
import com.delta.factengine.facts.retry.RetryResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pulls latest rates from a Frankfurter-compatible endpoint and stores them, adding inverse rates
 * for pairs the endpoint did not return directly.
 */
@Service
public class ExchangeRateRefreshService {
    private static final Logger log = LoggerFactory.getLogger(ExchangeRateRefreshService.class);

    private final EngineProperties properties;
    private final PoliteHttpClient httpClient;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper;
    private final FinancialsJdbcRepository repository;

    public ExchangeRateRefreshService(
        EngineProperties properties,
        PoliteHttpClient httpClient,
        RetryExecutor retryExecutor,
        ObjectMapper objectMapper,
        FinancialsJdbcRepository repository
    ) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.retryExecutor = retryExecutor;
        this.objectMapper = objectMapper;
        this.repository = repository;
    }

    /**
     * @return number of rate rows written
     */
    public int refresh() {
        Instant fetchDate = Instant.now();
        Map<String, ExchangeRateEntry> collected = new LinkedHashMap<>();
        RetryPolicy policy = RetryPolicy.from(properties.getRetry());

        for (String base : normalized(properties.getFx().getBaseCurrencies())) {
            List<String> targets = new ArrayList<>();
            for (String target : normalized(properties.getFx().getTargetCurrencies())) {
                if (!target.equals(base)) {
                    targets.add(target);
                }
            }
            if (targets.isEmpty()) {
                continue;
            }
            String url = properties.getFx().getApiUrl() + "?from=" + base + "&to=" + String.join(",", targets);
            RetryResult<Map<String, Double>> result = retryExecutor.executeDetailed(
                "fx " + base,
                () -> parseRates(httpClient.fetchBody(url, "application/json")),
                policy
            );
            if (!result.succeeded()) {
                log.warn("Could not refresh rates from {}: {}", base, result.failure().label());
                continue;
            }
            result.value().forEach((target, rate) ->
                collected.put(base + "->" + target, new ExchangeRateEntry(base, target, rate, fetchDate)));
        }

        for (ExchangeRateEntry direct : new ArrayList<>(collected.values())) {
            String inverseKey = direct.toCurrency() + "->" + direct.fromCurrency();
            if (!collected.containsKey(inverseKey)) {
                collected.put(inverseKey, new ExchangeRateEntry(
                    direct.toCurrency(), direct.fromCurrency(), 1.0 / direct.rate(), fetchDate));
            }
        }

        int written = 0;
        for (ExchangeRateEntry entry : collected.values()) {
            try {
                repository.upsertExchangeRate(entry);
                written++;
            } catch (DataAccessException e) {
                log.error("Failed to store rate {} -> {}", entry.fromCurrency(), entry.toCurrency(), e);
            }
        }
        log.info("Exchange rate refresh stored {} rates", written);
        return written;
    }

    Map<String, Double> parseRates(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchTerminalException("Rate response is not JSON", e);
        }
        JsonNode ratesNode = root == null ? null : root.get("rates");
        if (ratesNode == null || !ratesNode.isObject()) {
            throw new FetchTerminalException("Rate response has no rates object");
        }
        Map<String, Double> rates = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = ratesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            double rate = field.getValue().asDouble(Double.NaN);
            if (Double.isFinite(rate) && rate > 0) {
                rates.put(field.getKey().toUpperCase(Locale.ROOT), rate);
            } else {
                log.warn("Skipping invalid rate for {}: {}", field.getKey(), field.getValue());
            }
        }
        return rates;
    }

    private List<String> normalized(List<String> currencies) {
        List<String> result = new ArrayList<>();
        if (currencies == null) {
            return result;
        }
        for (String currency : currencies) {
            if (currency != null && !currency.isBlank()) {
                String value = currency.trim().toUpperCase(Locale.ROOT);
                if (!result.contains(value)) {
                    result.add(value);
                }
            }
        }
        return result;
    }
}
