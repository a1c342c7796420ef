package com.delta.factengine.facts.model;

import java.time.Instant;
import java.util.List;

public record RunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    int attempted,
    int inserted,
    int updated,
    int skipped,
    int failed,
    List<CompanyUpdateSummary> companies) {}
