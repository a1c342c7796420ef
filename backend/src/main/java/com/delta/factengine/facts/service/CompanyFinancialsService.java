package com.delta.factengine.facts.service;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.field.FinancialField;
import com.delta.factengine.facts.fx.ExchangeRateTable;
import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.CompanyUpdateStatus;
import com.delta.factengine.facts.model.CompanyUpdateSummary;
import com.delta.factengine.facts.model.FieldValue;
import com.delta.factengine.facts.model.FinancialSnapshot;
import com.delta.factengine.facts.model.RawFieldMap;
import com.delta.factengine.facts.model.SourceResult;
import com.delta.factengine.facts.model.UpsertOutcome;
import com.delta.factengine.facts.model.UpsertResult;
import com.delta.factengine.facts.reconcile.MergedRecord;
import com.delta.factengine.facts.reconcile.SourceReconciler;
import com.delta.factengine.facts.retry.RetryExecutor;
import com.delta.factengine.facts.retry.RetryPolicy;
import com.delta.factengine.facts.retry.RetryResult;
import com.delta.factengine.facts.sanitize.ValueSanitizer;
import com.delta.factengine.facts.source.FinancialDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-company pipeline: fetch each enabled source with retries, sanitize, reconcile, convert
 * monetary values to the storage currency and hand the snapshot to the staleness-gated upsert.
 */
@Service
public class CompanyFinancialsService {
    private static final Logger log = LoggerFactory.getLogger(CompanyFinancialsService.class);

    private final List<FinancialDataSource> sources;
    private final RetryExecutor retryExecutor;
    private final ValueSanitizer sanitizer;
    private final SourceReconciler reconciler;
    private final SnapshotUpsertService upsertService;
    private final RetryPolicy retryPolicy;

    public CompanyFinancialsService(
        List<FinancialDataSource> sources,
        RetryExecutor retryExecutor,
        ValueSanitizer sanitizer,
        SourceReconciler reconciler,
        SnapshotUpsertService upsertService,
        EngineProperties properties
    ) {
        this.sources = sources.stream()
            .sorted(Comparator.comparingInt(FinancialDataSource::priority))
            .toList();
        this.retryExecutor = retryExecutor;
        this.sanitizer = sanitizer;
        this.reconciler = reconciler;
        this.upsertService = upsertService;
        this.retryPolicy = RetryPolicy.from(properties.getRetry());
    }

    public CompanyUpdateSummary process(CompanyTarget target, RunContext context) {
        MDC.put("ticker", target.ticker());
        try {
            if (!upsertService.needsRefresh(target.companyId(), context.startedAt(), context.force())) {
                log.debug("{}: snapshot is fresh, skipping", target.ticker());
                return summary(target, CompanyUpdateStatus.SKIPPED_FRESH, UpsertResult.REASON_FRESH, null, Map.of());
            }

            Map<String, String> fetchFailures = new LinkedHashMap<>();
            List<SourceResult> results = new ArrayList<>();
            QuotedPrice quotedPrice = null;
            for (FinancialDataSource source : sources) {
                if (!source.isEnabled()) {
                    continue;
                }
                if (context.isShutdownRequested() && !results.isEmpty()) {
                    log.info("{}: shutdown requested, not fetching {}", target.ticker(), source.sourceId());
                    break;
                }
                RetryResult<RawFieldMap> fetched = retryExecutor.executeDetailed(
                    target.ticker() + " " + source.sourceId(),
                    () -> source.fetch(target),
                    retryPolicy
                );
                if (!fetched.succeeded()) {
                    fetchFailures.put(source.sourceId(), fetched.failure().label());
                    continue;
                }
                if (quotedPrice == null) {
                    quotedPrice = quotedPrice(target, fetched.value(), context);
                }
                toSourceResult(target, source, fetched.value()).ifPresent(results::add);
            }
            if (quotedPrice != null) {
                upsertService.recordDailyPrice(
                    target.companyId(), quotedPrice.value(), quotedPrice.currency(), context.startedAt(), context.force());
            }

            if (results.isEmpty()) {
                String detail = fetchFailures.isEmpty() ? "no values from any source" : "all sources failed";
                log.warn("{}: {} {}", target.ticker(), detail, fetchFailures);
                return summary(target, CompanyUpdateStatus.SKIPPED_NO_DATA, detail, null, fetchFailures);
            }

            MergedRecord merged = reconciler.reconcile(results, target.ticker());
            FinancialSnapshot snapshot = toSnapshot(target, merged, context);
            UpsertResult upsert = upsertService.upsert(target.companyId(), snapshot, context.startedAt(), context.force());
            return toSummary(target, upsert, fetchFailures);
        } finally {
            MDC.remove("ticker");
        }
    }

    private Optional<SourceResult> toSourceResult(CompanyTarget target, FinancialDataSource source, RawFieldMap raw) {
        if (raw == null || raw.isEmpty()) {
            log.info("{}: {} returned no values", target.ticker(), source.sourceId());
            return Optional.empty();
        }
        Map<FinancialField, Double> values = new EnumMap<>(FinancialField.class);
        raw.values().forEach((key, value) -> {
            if (RawFieldMap.STOCK_PRICE_KEY.equals(key)) {
                return;
            }
            Optional<FinancialField> field = FinancialField.fromKey(key);
            if (field.isEmpty()) {
                log.debug("{}: ignoring unknown field '{}' from {}", target.ticker(), key, source.sourceId());
                return;
            }
            Double sanitized = sanitizer.sanitize(value, key);
            if (sanitized != null) {
                values.put(field.get(), sanitized);
            }
        });
        if (values.isEmpty()) {
            log.info("{}: {} values did not survive sanitization", target.ticker(), source.sourceId());
            return Optional.empty();
        }
        String sourceId = raw.sourceId() == null ? source.sourceId() : raw.sourceId();
        return Optional.of(new SourceResult(sourceId, source.priority(), values, raw.currencyHint(), raw.fetchedAt()));
    }

    private QuotedPrice quotedPrice(CompanyTarget target, RawFieldMap raw, RunContext context) {
        if (raw == null || !raw.values().containsKey(RawFieldMap.STOCK_PRICE_KEY)) {
            return null;
        }
        Double price = sanitizer.sanitize(raw.values().get(RawFieldMap.STOCK_PRICE_KEY), RawFieldMap.STOCK_PRICE_KEY);
        if (price == null) {
            log.debug("{}: {} reported an unusable stock price", target.ticker(), raw.sourceId());
            return null;
        }
        String currency = raw.currencyHint() == null || raw.currencyHint().isBlank()
            ? context.exchangeRates().defaultSourceCurrency()
            : raw.currencyHint().trim().toUpperCase(Locale.ROOT);
        return new QuotedPrice(price, currency);
    }

    private record QuotedPrice(double value, String currency) {
    }

    private FinancialSnapshot toSnapshot(CompanyTarget target, MergedRecord merged, RunContext context) {
        ExchangeRateTable rates = context.exchangeRates();
        Map<FinancialField, FieldValue> fields = new EnumMap<>(FinancialField.class);
        merged.values().forEach((field, sourced) -> {
            if (!field.isMonetary()) {
                fields.put(field, new FieldValue(sourced.value(), null));
                return;
            }
            Double converted = rates.convert(sourced.value(), sourced.currency(), target.ticker() + " " + field.key());
            if (converted != null) {
                fields.put(field, new FieldValue(converted, rates.storageCurrency()));
            }
        });
        return new FinancialSnapshot(
            target.companyId(),
            fields,
            context.startedAt(),
            String.join(",", merged.contributingSources())
        );
    }

    private CompanyUpdateSummary toSummary(CompanyTarget target, UpsertResult upsert, Map<String, String> fetchFailures) {
        if (upsert.outcome() == UpsertOutcome.SKIPPED) {
            CompanyUpdateStatus status = UpsertResult.REASON_FRESH.equals(upsert.reason())
                ? CompanyUpdateStatus.SKIPPED_FRESH
                : CompanyUpdateStatus.SKIPPED_NO_DATA;
            return summary(target, status, upsert.reason(), upsert, fetchFailures);
        }
        CompanyUpdateStatus status = upsert.outcome() == UpsertOutcome.INSERTED
            ? CompanyUpdateStatus.INSERTED
            : CompanyUpdateStatus.UPDATED;
        log.info("{}: {} {} fields", target.ticker(), status, upsert.writtenFields().size());
        return summary(target, status, null, upsert, fetchFailures);
    }

    private CompanyUpdateSummary summary(
        CompanyTarget target,
        CompanyUpdateStatus status,
        String detail,
        UpsertResult upsert,
        Map<String, String> fetchFailures
    ) {
        return new CompanyUpdateSummary(
            target.companyId(),
            target.ticker(),
            status,
            detail,
            upsert == null ? Set.of() : upsert.writtenFields(),
            Map.copyOf(fetchFailures)
        );
    }
}
