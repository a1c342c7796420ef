package com.delta.factengine.facts.service;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.field.FinancialField;
import com.delta.factengine.facts.model.FieldValue;
import com.delta.factengine.facts.model.FinancialSnapshot;
import com.delta.factengine.facts.model.StockPrice;
import com.delta.factengine.facts.model.UpsertOutcome;
import com.delta.factengine.facts.model.UpsertResult;
import com.delta.factengine.facts.persistence.FinancialsJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes a company's snapshot only when it is missing or stale, and only the fields that passed
 * validation. Writers are serialized; readers are not.
 */
@Service
public class SnapshotUpsertService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotUpsertService.class);

    private final FinancialsJdbcRepository repository;
    private final Duration freshnessWindow;
    private final double priceJumpThreshold;
    private final ReentrantLock writeLock = new ReentrantLock();

    public SnapshotUpsertService(FinancialsJdbcRepository repository, EngineProperties properties) {
        this.repository = repository;
        this.freshnessWindow = Duration.ofHours(properties.getFreshnessWindowHours());
        this.priceJumpThreshold = properties.getPriceJumpThreshold();
    }

    public boolean needsRefresh(long companyId, Instant now, boolean force) {
        if (force) {
            return true;
        }
        Optional<FinancialsJdbcRepository.SnapshotStamp> stamp = repository.findSnapshotStamp(companyId);
        if (stamp.isEmpty()) {
            return true;
        }
        Instant lastUpdated = FinancialsJdbcRepository.parseInstant(stamp.get().lastUpdated());
        if (lastUpdated == null) {
            log.debug("Company {} has unparsable last_updated '{}'; treating as stale",
                companyId, stamp.get().lastUpdated());
            return true;
        }
        return lastUpdated.isBefore(now.minus(freshnessWindow));
    }

    public UpsertResult upsert(long companyId, FinancialSnapshot snapshot, Instant now, boolean force) {
        writeLock.lock();
        try {
            if (!needsRefresh(companyId, now, force)) {
                return UpsertResult.skipped(UpsertResult.REASON_FRESH);
            }
            Map<FinancialField, FieldValue> writeSet = validate(companyId, snapshot);
            if (writeSet.isEmpty()) {
                log.info("Company {}: no valid data to write", companyId);
                return UpsertResult.skipped(UpsertResult.REASON_NO_VALID_DATA);
            }
            UpsertOutcome outcome = repository.upsertSnapshot(
                companyId,
                writeSet,
                now.toString(),
                snapshot == null ? null : snapshot.dataSource()
            );
            log.debug("Company {}: {} {} fields", companyId, outcome, writeSet.size());
            return new UpsertResult(outcome, null, Set.copyOf(writeSet.keySet()));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Records the latest quoted price for the UTC date of {@code now}. One row per company and date:
     * an existing row is only overwritten when {@code force} is set. Non-positive prices and jumps
     * beyond the configured threshold against the previous stored price (same currency) are skipped.
     */
    public UpsertOutcome recordDailyPrice(long companyId, Double price, String currency, Instant now, boolean force) {
        if (price == null || !Double.isFinite(price) || price <= 0) {
            log.warn("Company {}: skipping invalid stock price {}", companyId, price);
            return UpsertOutcome.SKIPPED;
        }
        if (currency == null || currency.isBlank()) {
            log.warn("Company {}: skipping stock price {} without a currency", companyId, price);
            return UpsertOutcome.SKIPPED;
        }
        LocalDate priceDate = LocalDate.ofInstant(now, ZoneOffset.UTC);
        writeLock.lock();
        try {
            if (!force && repository.findStockPrice(companyId, priceDate).isPresent()) {
                log.debug("Company {}: price for {} already stored", companyId, priceDate);
                return UpsertOutcome.SKIPPED;
            }
            Optional<StockPrice> previous = repository.findLatestStockPriceBefore(companyId, priceDate);
            if (previous.isPresent() && isImplausibleJump(companyId, previous.get(), price, currency)) {
                return UpsertOutcome.SKIPPED;
            }
            UpsertOutcome outcome = repository.upsertStockPrice(
                new StockPrice(companyId, priceDate, price, currency),
                now.toString()
            );
            log.debug("Company {}: price {} {} for {} {}", companyId, price, currency, priceDate, outcome);
            return outcome;
        } finally {
            writeLock.unlock();
        }
    }

    private boolean isImplausibleJump(long companyId, StockPrice previous, double price, String currency) {
        if (previous.value() <= 0 || !previous.currency().equalsIgnoreCase(currency)) {
            return false;
        }
        double variance = Math.abs(price - previous.value()) / Math.max(previous.value(), 0.01);
        if (variance > priceJumpThreshold) {
            log.warn("Company {}: price moved {}% since {} ({} -> {} {}); skipping",
                companyId,
                String.format("%.1f", variance * 100),
                previous.priceDate(),
                previous.value(),
                price,
                currency);
            return true;
        }
        return false;
    }

    Map<FinancialField, FieldValue> validate(long companyId, FinancialSnapshot snapshot) {
        Map<FinancialField, FieldValue> writeSet = new EnumMap<>(FinancialField.class);
        if (snapshot == null) {
            return writeSet;
        }
        snapshot.fields().forEach((field, value) -> {
            if (!Double.isFinite(value.value())) {
                log.warn("Company {}: dropping non-finite {}", companyId, field.key());
                return;
            }
            if (!field.isPlausible(value.value())) {
                log.warn("Company {}: dropping implausible {}={} (minimum {})",
                    companyId, field.key(), value.value(), field.minimumPlausible());
                return;
            }
            writeSet.put(field, value);
        });
        return writeSet;
    }
}
