package com.delta.factengine.facts.cli;

import com.delta.factengine.facts.field.FinancialField;
import com.delta.factengine.facts.model.FieldValue;
import com.delta.factengine.facts.model.SnapshotView;
import com.delta.factengine.facts.persistence.FinancialsJdbcRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of stored snapshots for {@code --inspect}.
 */
@Service
public class SnapshotInspectionService {
    static final int DEFAULT_LIMIT = 50;

    private final FinancialsJdbcRepository repository;
    private final ObjectMapper objectMapper;

    public SnapshotInspectionService(FinancialsJdbcRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public List<Map<String, Object>> inspect(Long companyId, Integer limit) {
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : limit;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (SnapshotView view : repository.findSnapshotViews(companyId, effectiveLimit)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("company_id", view.company().companyId());
            row.put("ticker", view.company().ticker());
            row.put("name", view.company().name());
            for (FinancialField field : FinancialField.values()) {
                FieldValue value = view.snapshot().field(field);
                row.put(field.key(), value == null ? null : value.value());
                if (field.isMonetary()) {
                    row.put(field.currencyColumn(), value == null ? null : value.currency());
                }
            }
            row.put("last_updated", view.lastUpdatedRaw());
            row.put("data_source", view.snapshot().dataSource());
            rows.add(row);
        }
        return rows;
    }

    public String inspectAsJson(Long companyId, Integer limit) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(inspect(companyId, limit));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render snapshots as JSON", e);
        }
    }
}
