package com.delta.factengine.facts.sanitize;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one raw financial figure ("$1.2B", "(500K)", "N/A", caption noise) into a finite double or null.
 */
@Component
public class ValueSanitizer {
    private static final Logger log = LoggerFactory.getLogger(ValueSanitizer.class);

    private static final Set<String> SENTINELS = Set.of(
        "n/a", "na", "--", "-", "nan", "infinity", "-infinity", "+infinity", "null", "undefined"
    );
    private static final List<String> NOISE_MARKERS = List.of("copyright", "©", "all rights reserved");

    private static final Pattern CHART_CAPTION =
        Pattern.compile("ChartBar.*?End of interactive chart\\.?", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern PERCENT_ANNOTATION =
        Pattern.compile("\\(?\\s*[+-]?\\d+(?:[.,]\\d+)?\\s*%\\s*\\)?");
    private static final Pattern GROWTH_ANNOTATION =
        Pattern.compile("\\b(?:growth|yoy|qoq|ttm)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_TOKEN =
        Pattern.compile("(?<![\\d.,])(?:19|20)\\d{2}(?![\\d.,%A-Za-z])");
    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("[$€£¥]");
    private static final Pattern PARENTHESIZED = Pattern.compile("^\\(\\s*(.*?)\\s*\\)$", Pattern.DOTALL);
    private static final Pattern MAGNITUDE_SUFFIX =
        Pattern.compile("(\\d)\\s*([TBMK])(?![A-Za-z])", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("-?(?:\\d+\\.?\\d*|\\.\\d+)");
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private static final Map<Character, Double> MULTIPLIERS = Map.of(
        'T', 1e12,
        'B', 1e9,
        'M', 1e6,
        'K', 1e3
    );

    public Double sanitize(Object raw, String fieldName) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return finiteOrNull(number.doubleValue(), fieldName, raw);
        }
        if (raw instanceof JsonNode node) {
            return sanitizeJson(node, fieldName);
        }
        if (raw instanceof Map<?, ?> map && map.containsKey("raw")) {
            return sanitize(map.get("raw"), fieldName);
        }
        return sanitizeText(raw.toString(), fieldName);
    }

    private Double sanitizeJson(JsonNode node, String fieldName) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return finiteOrNull(node.asDouble(), fieldName, node);
        }
        if (node.isTextual()) {
            return sanitizeText(node.asText(), fieldName);
        }
        if (node.isObject() && node.has("raw")) {
            return sanitizeJson(node.get("raw"), fieldName);
        }
        log.debug("Sanitizing {}: unsupported JSON shape {}", fieldName, node.getNodeType());
        return null;
    }

    private Double sanitizeText(String raw, String fieldName) {
        String value = raw.trim();
        if (value.isEmpty() || SENTINELS.contains(value.toLowerCase(Locale.ROOT)) || containsNoiseMarker(value)) {
            log.debug("Sanitizing {}: null/invalid value '{}'", fieldName, abbreviate(value));
            return null;
        }

        String cleaned = CHART_CAPTION.matcher(value).replaceAll(" ");
        cleaned = PERCENT_ANNOTATION.matcher(cleaned).replaceAll(" ");
        cleaned = GROWTH_ANNOTATION.matcher(cleaned).replaceAll(" ");
        cleaned = stripYearTokens(cleaned);
        cleaned = CURRENCY_SYMBOLS.matcher(cleaned).replaceAll("").trim();

        boolean negative = false;
        Matcher parenthesized = PARENTHESIZED.matcher(cleaned);
        if (parenthesized.matches()) {
            negative = true;
            cleaned = parenthesized.group(1);
        }

        String literal = cleaned.replaceAll("[^0-9.\\-]", "");
        Matcher numeric = NUMERIC_LITERAL.matcher(literal);
        if (!numeric.find()) {
            log.debug("Sanitizing {}: non-numeric value '{}'", fieldName, abbreviate(value));
            return null;
        }

        double number;
        try {
            number = Double.parseDouble(numeric.group());
        } catch (NumberFormatException e) {
            log.debug("Sanitizing {}: unparsable literal '{}'", fieldName, numeric.group());
            return null;
        }
        if (!Double.isFinite(number)) {
            return null;
        }

        double parsed = number * magnitudeMultiplier(cleaned);
        if (negative) {
            parsed = -Math.abs(parsed);
        }
        if (!Double.isFinite(parsed)) {
            log.debug("Sanitizing {}: overflow for '{}'", fieldName, abbreviate(value));
            return null;
        }
        Double result = parsed == 0.0 ? 0.0 : parsed;
        log.debug("Sanitized {}: '{}' -> {}", fieldName, abbreviate(value), result);
        return result;
    }

    private double magnitudeMultiplier(String preStrip) {
        Matcher matcher = MAGNITUDE_SUFFIX.matcher(preStrip);
        Character suffix = null;
        while (matcher.find()) {
            suffix = Character.toUpperCase(matcher.group(2).charAt(0));
        }
        if (suffix == null) {
            return 1d;
        }
        return MULTIPLIERS.getOrDefault(suffix, 1d);
    }

    private String stripYearTokens(String value) {
        String stripped = YEAR_TOKEN.matcher(value).replaceAll(" ");
        // a lone year-shaped number is the figure itself
        return DIGIT.matcher(stripped).find() ? stripped : value;
    }

    private boolean containsNoiseMarker(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        for (String marker : NOISE_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private Double finiteOrNull(double value, String fieldName, Object raw) {
        if (!Double.isFinite(value)) {
            log.debug("Sanitizing {}: non-finite number {}", fieldName, raw);
            return null;
        }
        return value == 0.0 ? 0.0 : value;
    }

    private String abbreviate(String value) {
        if (value == null || value.length() <= 80) {
            return value;
        }
        return value.substring(0, 77) + "...";
    }
}
