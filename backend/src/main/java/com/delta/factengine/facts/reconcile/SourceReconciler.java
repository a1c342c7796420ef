package com.delta.factengine.facts.reconcile;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.field.FinancialField;
import com.delta.factengine.facts.model.SourceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Priority-ordered merge: for each field the first source (lowest priority number) with a non-null, plausible
 * value wins. Disagreeing lower-priority values are only logged.
 */
@Component
public class SourceReconciler {
    private static final Logger log = LoggerFactory.getLogger(SourceReconciler.class);

    private static final Comparator<SourceResult> PRIORITY_ORDER = Comparator
        .comparingInt(SourceResult::priority)
        .thenComparing(SourceResult::sourceId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final double discrepancyThreshold;

    public SourceReconciler(EngineProperties properties) {
        this.discrepancyThreshold = properties.getReconcile().getDiscrepancyThreshold();
    }

    public MergedRecord reconcile(List<SourceResult> sources, String ticker) {
        if (sources == null || sources.isEmpty()) {
            return new MergedRecord(Map.of(), List.of());
        }
        List<SourceResult> ordered = new ArrayList<>();
        for (SourceResult source : sources) {
            if (source != null) {
                ordered.add(source);
            }
        }
        ordered.sort(PRIORITY_ORDER);

        Map<FinancialField, MergedRecord.SourcedValue> merged = new EnumMap<>(FinancialField.class);
        Set<String> contributing = new LinkedHashSet<>();
        for (SourceResult source : ordered) {
            for (Map.Entry<FinancialField, Double> entry : source.values().entrySet()) {
                Double value = entry.getValue();
                if (value == null) {
                    continue;
                }
                if (!entry.getKey().isPlausible(value)) {
                    log.info("{}: ignoring implausible {}={} from {}",
                        ticker, entry.getKey().key(), value, source.sourceId());
                    continue;
                }
                MergedRecord.SourcedValue winner = merged.get(entry.getKey());
                if (winner == null) {
                    merged.put(entry.getKey(), new MergedRecord.SourcedValue(value, source.currency(), source.sourceId()));
                    contributing.add(source.sourceId());
                } else {
                    auditDiscrepancy(ticker, entry.getKey(), winner, value, source);
                }
            }
        }
        return new MergedRecord(merged, new ArrayList<>(contributing));
    }

    private void auditDiscrepancy(
        String ticker,
        FinancialField field,
        MergedRecord.SourcedValue winner,
        double candidate,
        SourceResult loser
    ) {
        if (field.isMonetary() && !Objects.equals(winner.currency(), loser.currency())) {
            return;
        }
        double reference = Math.abs(winner.value());
        if (reference == 0.0) {
            return;
        }
        double relative = Math.abs(winner.value() - candidate) / reference;
        if (relative > discrepancyThreshold) {
            log.warn("{}: {} discrepancy {}% ({}={} vs {}={}); keeping {}",
                ticker,
                field.key(),
                String.format("%.1f", relative * 100),
                winner.sourceId(),
                winner.value(),
                loser.sourceId(),
                candidate,
                winner.sourceId());
        }
    }
}
