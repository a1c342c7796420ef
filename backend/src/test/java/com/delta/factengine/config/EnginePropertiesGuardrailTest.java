package com.delta.factengine.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnginePropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        EngineProperties properties = new EngineProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("fact-engine/0.1"));
    }

    @Test
    void concurrencyAndDelayAreClamped() {
        EngineProperties properties = new EngineProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());

        properties.setGlobalConcurrency(500);
        assertEquals(16, properties.getGlobalConcurrency());
    }

    @Test
    void priceJumpThresholdFallsBackWhenNotPositive() {
        EngineProperties properties = new EngineProperties();
        properties.setPriceJumpThreshold(0);
        assertEquals(0.25, properties.getPriceJumpThreshold());
        properties.setPriceJumpThreshold(0.4);
        assertEquals(0.4, properties.getPriceJumpThreshold());
    }

    @Test
    void retrySettingsNeverGoNegative() {
        EngineProperties properties = new EngineProperties();
        properties.getRetry().setMaxRetries(-1);
        properties.getRetry().setBaseDelayMs(-100);
        properties.getRetry().setTimeoutMs(0);
        assertEquals(0, properties.getRetry().getMaxRetries());
        assertEquals(0, properties.getRetry().getBaseDelayMs());
        assertEquals(1, properties.getRetry().getTimeoutMs());
    }

    @Test
    void currenciesAreNormalized() {
        EngineProperties properties = new EngineProperties();
        properties.setStorageCurrency(" cad ");
        properties.setDefaultSourceCurrency("");
        assertEquals("CAD", properties.getStorageCurrency());
        assertEquals("USD", properties.getDefaultSourceCurrency());
    }

    @Test
    void leaseDefaultsMatchRunSafetyExpectations() {
        EngineProperties properties = new EngineProperties();
        assertEquals(30, properties.getLease().getStaleAfterMinutes());
        properties.getLease().setHeartbeatSeconds(0);
        assertEquals(1, properties.getLease().getHeartbeatSeconds());
    }
}
