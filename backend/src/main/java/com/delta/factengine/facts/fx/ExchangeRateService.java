package com.delta.factengine.facts.fx;

import com.delta.factengine.config.EngineProperties;
import com.delta.factengine.facts.model.ExchangeRateEntry;
import com.delta.factengine.facts.persistence.FinancialsJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ExchangeRateService {
    private static final Logger log = LoggerFactory.getLogger(ExchangeRateService.class);

    private final FinancialsJdbcRepository repository;
    private final EngineProperties properties;

    public ExchangeRateService(FinancialsJdbcRepository repository, EngineProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public ExchangeRateTable loadTable() {
        List<ExchangeRateEntry> entries;
        try {
            entries = repository.loadExchangeRates();
        } catch (DataAccessException e) {
            log.error("Failed to load exchange rates; continuing with fallback defaults", e);
            entries = List.of();
        }
        ExchangeRateTable table = ExchangeRateTable.fromEntries(
            entries,
            properties.getStorageCurrency(),
            properties.getDefaultSourceCurrency()
        );
        log.info("Loaded {} exchange rate pairs (storage currency {}, degraded={})",
            table.size(), table.storageCurrency(), table.isDegraded());
        return table;
    }
}
