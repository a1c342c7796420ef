package com.delta.factengine.facts.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    SKIPPED
}
