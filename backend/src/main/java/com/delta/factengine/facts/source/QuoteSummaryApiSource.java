package com.delta.factengine.facts.source;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.field.FinancialField;
import com.delta.factengine.facts.http.FetchTerminalException;
import com.delta.factengine.facts.http.PoliteHttpClient;
import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.RawFieldMap;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Primary source: a quote-summary JSON document with {@code price}, {@code summaryDetail},
 * {@code financialData}, {@code defaultKeyStatistics}, {@code incomeStatementHistory} and
 * {@code balanceSheetHistory} modules.
 */
@Component
public class QuoteSummaryApiSource implements FinancialDataSource {
    private static final Logger log = LoggerFactory.getLogger(QuoteSummaryApiSource.class);
    public static final String SOURCE_ID = "quote_api";

    private final EngineProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public QuoteSummaryApiSource(EngineProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public int priority() {
        return properties.getSources().getQuoteApi().getPriority();
    }

    @Override
    public boolean isEnabled() {
        return properties.getSources().getQuoteApi().isEnabled();
    }

    @Override
    public RawFieldMap fetch(CompanyTarget company) throws IOException, InterruptedException {
        String url = properties.getSources().getQuoteApi().getUrlTemplate()
            .replace("{ticker}", URLEncoder.encode(company.ticker(), StandardCharsets.UTF_8));
        String body = httpClient.fetchBody(url, "application/json");
        return parse(body, company.ticker());
    }

    RawFieldMap parse(String body, String ticker) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchTerminalException("Quote summary for " + ticker + " is not JSON", e);
        }
        JsonNode summary = root == null ? null : root.path("quoteSummary");
        if (summary == null || summary.isMissingNode()) {
            throw new FetchTerminalException("Quote summary for " + ticker + " has no quoteSummary node");
        }
        JsonNode error = summary.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new FetchTerminalException("Quote summary error for " + ticker + ": " + error.path("description").asText(""));
        }
        JsonNode results = summary.path("result");
        if (!results.isArray() || results.isEmpty()) {
            throw new FetchTerminalException("Quote summary for " + ticker + " has no result");
        }
        JsonNode result = results.get(0);
        JsonNode price = result.path("price");
        JsonNode detail = result.path("summaryDetail");
        JsonNode financial = result.path("financialData");
        JsonNode stats = result.path("defaultKeyStatistics");
        JsonNode income = result.path("incomeStatementHistory").path("incomeStatementHistory").path(0);
        JsonNode balance = result.path("balanceSheetHistory").path("balanceSheetStatements").path(0);

        Map<String, Object> values = new LinkedHashMap<>();
        put(values, FinancialField.MARKET_CAP, price.path("marketCap"), detail.path("marketCap"));
        put(values, FinancialField.ENTERPRISE_VALUE, stats.path("enterpriseValue"));
        put(values, FinancialField.REVENUE, financial.path("totalRevenue"), income.path("totalRevenue"));
        put(values, FinancialField.NET_INCOME, income.path("netIncome"), stats.path("netIncomeToCommon"));
        put(values, FinancialField.CASH, financial.path("totalCash"), balance.path("cash"));
        put(values, FinancialField.DEBT, financial.path("totalDebt"), balance.path("totalLiab"));
        put(values, FinancialField.LIABILITIES, balance.path("totalLiab"));
        put(values, FinancialField.EBITDA, financial.path("ebitda"));
        put(values, FinancialField.FREE_CASH_FLOW, financial.path("freeCashflow"));
        put(values, FinancialField.OPERATING_INCOME, income.path("operatingIncome"));
        put(values, FinancialField.GROSS_PROFIT, financial.path("grossProfits"), income.path("grossProfit"));
        put(values, FinancialField.SHARES_OUTSTANDING, stats.path("sharesOutstanding"));
        put(values, FinancialField.TRAILING_PE, detail.path("trailingPE"));
        put(values, FinancialField.FORWARD_PE, detail.path("forwardPE"), stats.path("forwardPE"));
        put(values, FinancialField.PRICE_TO_SALES, detail.path("priceToSalesTrailing12Months"));
        put(values, FinancialField.PRICE_TO_BOOK, stats.path("priceToBook"));

        put(values, RawFieldMap.STOCK_PRICE_KEY, price.path("regularMarketPrice"), detail.path("regularMarketPreviousClose"));

        String currency = textOrNull(price.path("currency"));
        if (currency == null) {
            currency = textOrNull(financial.path("financialCurrency"));
        }
        log.debug("{}: quote summary yielded {} candidate fields (currency {})", ticker, values.size(), currency);
        return new RawFieldMap(SOURCE_ID, values, currency, Instant.now());
    }

    private void put(Map<String, Object> values, FinancialField field, JsonNode... candidates) {
        put(values, field.key(), candidates);
    }

    private void put(Map<String, Object> values, String key, JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate == null || candidate.isMissingNode() || candidate.isNull()) {
                continue;
            }
            if (candidate.isObject() && !candidate.has("raw")) {
                continue;
            }
            values.put(key, candidate);
            return;
        }
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
