package com.delta.factengine.facts.source;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.http.PoliteHttpClient;
import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.RawFieldMap;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Secondary verification source: a public HTML quote page whose key statistics are laid out as
 * label/value pairs. Labels are matched against {@code engine.sources.summary-page.labels}.
 */
@Component
public class SummaryPageSource implements FinancialDataSource {
    private static final Logger log = LoggerFactory.getLogger(SummaryPageSource.class);
    public static final String SOURCE_ID = "summary_page";
    private static final Pattern TRAILING_CURRENCY = Pattern.compile("\\b([A-Z]{3})\\s*$");

    private final EngineProperties properties;
    private final PoliteHttpClient httpClient;

    public SummaryPageSource(EngineProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public int priority() {
        return properties.getSources().getSummaryPage().getPriority();
    }

    @Override
    public boolean isEnabled() {
        return properties.getSources().getSummaryPage().isEnabled();
    }

    @Override
    public RawFieldMap fetch(CompanyTarget company) throws IOException, InterruptedException {
        String url = properties.getSources().getSummaryPage().getUrlTemplate()
            .replace("{ticker}", URLEncoder.encode(company.ticker(), StandardCharsets.UTF_8));
        String html = httpClient.fetchBody(url, "text/html,application/xhtml+xml");
        return parse(Jsoup.parse(html, url), company.ticker());
    }

    RawFieldMap parse(Document document, String ticker) {
        Map<String, String> labels = normalizedLabels();
        Map<String, Object> values = new LinkedHashMap<>();
        String detectedCurrency = null;
        for (Element element : document.getAllElements()) {
            String label = normalizeLabel(element.ownText());
            String fieldKey = labels.get(label);
            if (fieldKey == null || values.containsKey(fieldKey)) {
                continue;
            }
            String value = valueFor(element);
            if (value == null) {
                continue;
            }
            values.put(fieldKey, value);
            if (detectedCurrency == null) {
                Matcher matcher = TRAILING_CURRENCY.matcher(value);
                if (matcher.find()) {
                    detectedCurrency = matcher.group(1);
                }
            }
        }
        String configured = properties.getSources().getSummaryPage().getCurrency();
        String currency = configured == null || configured.isBlank() ? detectedCurrency : configured.trim();
        log.debug("{}: summary page yielded {} labelled values", ticker, values.size());
        return new RawFieldMap(SOURCE_ID, values, currency, Instant.now());
    }

    private String valueFor(Element labelElement) {
        Element sibling = labelElement.nextElementSibling();
        if (sibling != null && !sibling.text().isBlank()) {
            return sibling.text().trim();
        }
        Element parent = labelElement.parent();
        Element parentSibling = parent == null ? null : parent.nextElementSibling();
        if (parentSibling != null && !parentSibling.text().isBlank()) {
            return parentSibling.text().trim();
        }
        return null;
    }

    private Map<String, String> normalizedLabels() {
        Map<String, String> normalized = new LinkedHashMap<>();
        properties.getSources().getSummaryPage().getLabels()
            .forEach((label, field) -> normalized.put(normalizeLabel(label), field));
        return normalized;
    }

    private String normalizeLabel(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\u00A0', ' ').trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
