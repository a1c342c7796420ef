package com.delta.factengine.facts.retry;

import com.delta.factengine.config.EngineProperties;

import java.time.Duration;

public record RetryPolicy(int maxRetries, Duration baseDelay, Duration timeout) {
    public RetryPolicy {
        maxRetries = Math.max(0, maxRetries);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(35) : timeout;
    }

    public static RetryPolicy from(EngineProperties.Retry retry) {
        return new RetryPolicy(
            retry.getMaxRetries(),
            Duration.ofMillis(retry.getBaseDelayMs()),
            Duration.ofMillis(retry.getTimeoutMs())
        );
    }

    public int maxAttempts() {
        return 1 + maxRetries;
    }
}
