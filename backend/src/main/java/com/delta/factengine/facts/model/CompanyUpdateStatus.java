package com.delta.factengine.facts.model;

public enum CompanyUpdateStatus {
    INSERTED,
    UPDATED,
    SKIPPED_FRESH,
    SKIPPED_NO_DATA,
    FAILED;

    public boolean isSkipped() {
        return this == SKIPPED_FRESH || this == SKIPPED_NO_DATA;
    }
}
