package com.delta.factengine.facts.source;

import com.delta.factengine.facts.model.CompanyTarget;
import com.delta.factengine.facts.model.RawFieldMap;

import java.io.IOException;

/**
 * A provider of raw financial figures for one company.
 *
 * <p>Implementations throw {@link com.delta.factengine.facts.http.FetchStatusException} for HTTP
 * failures and {@link com.delta.factengine.facts.http.FetchTerminalException} for responses that
 * cannot be interpreted; the caller decides what is retried.
 */
public interface FinancialDataSource {
    String sourceId();

    int priority();

    boolean isEnabled();

    RawFieldMap fetch(CompanyTarget company) throws IOException, InterruptedException;
}
