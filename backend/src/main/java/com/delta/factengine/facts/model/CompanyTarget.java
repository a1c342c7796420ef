package com.delta.factengine.facts.model;

public record CompanyTarget(
    long companyId,
    String ticker,
    String name
) {
}
