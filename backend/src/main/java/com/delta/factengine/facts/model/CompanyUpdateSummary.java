package com.delta.factengine.facts.model;

import com.delta.factengine.facts.field.FinancialField;

import java.util.Map;
import java.util.Set;

public record CompanyUpdateSummary(
    long companyId,
    String ticker,
    CompanyUpdateStatus status,
    String detail,
    Set<FinancialField> fieldsWritten,
    Map<String, String> fetchFailures) {

    public static CompanyUpdateSummary failed(CompanyTarget target, String detail) {
        return new CompanyUpdateSummary(
            target.companyId(),
            target.ticker(),
            CompanyUpdateStatus.FAILED,
            detail,
            Set.of(),
            Map.of()
        );
    }
}
