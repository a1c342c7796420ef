package com.delta.factengine.facts.http;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTimeout() {
        return errorCode != null && errorCode.contains("timeout");
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
