package com.delta.factengine.facts.model;

public record SnapshotView(
    CompanyTarget company,
    FinancialSnapshot snapshot,
    String lastUpdatedRaw
) {
}
