package com.delta.factengine.facts.http;

/**
 * A fetch that reached the remote side but came back with a non-success HTTP status.
 */
public class FetchStatusException extends RuntimeException {
    private final int statusCode;
    private final String url;

    public FetchStatusException(int statusCode, String url) {
        super("HTTP " + statusCode + " from " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
