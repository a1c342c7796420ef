package com.delta.factengine.facts.model;

import java.util.List;

public record ImportSummary(
    int companiesUpserted,
    int rowsSkipped,
    List<String> sampleErrors
) {
}
