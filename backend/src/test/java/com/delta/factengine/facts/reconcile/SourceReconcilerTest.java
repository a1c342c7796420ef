package com.delta.factengine.facts.reconcile;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.field.FinancialField;
import com.delta.factengine.facts.model.SourceResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class SourceReconcilerTest {
    private final SourceReconciler reconciler = new SourceReconciler(new EngineProperties());

    @Test
    void firstNonNullInPriorityOrderWins() {
        Map<FinancialField, Double> secondaryValues = new HashMap<>();
        secondaryValues.put(FinancialField.MARKET_CAP, null);
        secondaryValues.put(FinancialField.SHARES_OUTSTANDING, 4.05e9);
        secondaryValues.put(FinancialField.REVENUE, 3.5e8);
        SourceResult primary = new SourceResult("primary", 1, Map.of(
            FinancialField.MARKET_CAP, 4.502e11,
            FinancialField.SHARES_OUTSTANDING, 4.1e9
        ), "USD", Instant.now());
        SourceResult secondary = new SourceResult("secondary", 2, secondaryValues, "USD", Instant.now());

        MergedRecord merged = reconciler.reconcile(List.of(secondary, primary), "XOM");

        assertThat(merged.value(FinancialField.MARKET_CAP)).isEqualTo(4.502e11);
        assertThat(merged.value(FinancialField.SHARES_OUTSTANDING)).isEqualTo(4.1e9);
        assertThat(merged.value(FinancialField.REVENUE)).isEqualTo(3.5e8);
        assertThat(merged.sourceOf(FinancialField.SHARES_OUTSTANDING)).isEqualTo("primary");
        assertThat(merged.sourceOf(FinancialField.REVENUE)).isEqualTo("secondary");
        assertThat(merged.contributingSources()).containsExactly("primary", "secondary");
    }

    @Test
    void resultDoesNotDependOnInputOrder() {
        List<SourceResult> sources = new ArrayList<>();
        sources.add(new SourceResult("a", 1, Map.of(FinancialField.CASH, 1.0), "USD", Instant.now()));
        sources.add(new SourceResult("b", 2, Map.of(FinancialField.CASH, 2.0, FinancialField.DEBT, 5.0), "USD", Instant.now()));
        sources.add(new SourceResult("c", 3, Map.of(FinancialField.DEBT, 7.0, FinancialField.EBITDA, 9.0), "USD", Instant.now()));
        MergedRecord expected = reconciler.reconcile(sources, "T");

        Random random = new Random(7L);
        for (int i = 0; i < 20; i++) {
            List<SourceResult> shuffled = new ArrayList<>(sources);
            Collections.shuffle(shuffled, random);
            assertThat(reconciler.reconcile(shuffled, "T")).isEqualTo(expected);
        }
        assertThat(expected.value(FinancialField.CASH)).isEqualTo(1.0);
        assertThat(expected.value(FinancialField.DEBT)).isEqualTo(5.0);
        assertThat(expected.value(FinancialField.EBITDA)).isEqualTo(9.0);
    }

    @Test
    void discrepancyDoesNotChangeWinner() {
        SourceResult primary = new SourceResult("primary", 1, Map.of(FinancialField.REVENUE, 100.0), "USD", Instant.now());
        SourceResult secondary = new SourceResult("secondary", 2, Map.of(FinancialField.REVENUE, 200.0), "USD", Instant.now());

        MergedRecord merged = reconciler.reconcile(List.of(primary, secondary), "ABC");

        assertThat(merged.value(FinancialField.REVENUE)).isEqualTo(100.0);
    }

    @Test
    void implausiblePrimaryValueFallsThroughToNextSource() {
        SourceResult primary = new SourceResult("primary", 1, Map.of(
            FinancialField.MARKET_CAP, 500_000.0,
            FinancialField.REVENUE, 42.0
        ), "USD", Instant.now());
        SourceResult secondary = new SourceResult("secondary", 2, Map.of(FinancialField.MARKET_CAP, 5e9), "USD", Instant.now());

        MergedRecord merged = reconciler.reconcile(List.of(primary, secondary), "TINY");

        assertThat(merged.value(FinancialField.MARKET_CAP)).isEqualTo(5e9);
        assertThat(merged.sourceOf(FinancialField.MARKET_CAP)).isEqualTo("secondary");
        assertThat(merged.value(FinancialField.REVENUE)).isEqualTo(42.0);
    }

    @Test
    void implausibleValueFromEverySourceLeavesFieldUnset() {
        SourceResult only = new SourceResult("only", 1, Map.of(FinancialField.SHARES_OUTSTANDING, 12.0), "USD", Instant.now());

        MergedRecord merged = reconciler.reconcile(List.of(only), "TINY");

        assertThat(merged.value(FinancialField.SHARES_OUTSTANDING)).isNull();
        assertThat(merged.contributingSources()).isEmpty();
    }

    @Test
    void noSourcesYieldsEmptyRecord() {
        assertThat(reconciler.reconcile(List.of(), "NONE").isEmpty()).isTrue();
    }
}
