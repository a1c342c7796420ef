package com.delta.factengine.facts.retry;

/**
 * Why a retried operation gave up. {@link #label()} is the value written to logs and run summaries.
 */
public record FetchFailureReason(Kind kind, Integer statusCode) {
    public static final FetchFailureReason TIMEOUT = new FetchFailureReason(Kind.TIMEOUT, null);
    public static final FetchFailureReason MAX_RETRIES_EXCEEDED = new FetchFailureReason(Kind.MAX_RETRIES_EXCEEDED, null);
    public static final FetchFailureReason MALFORMED_RESPONSE = new FetchFailureReason(Kind.MALFORMED_RESPONSE, null);
    public static final FetchFailureReason INTERRUPTED = new FetchFailureReason(Kind.INTERRUPTED, null);

    public enum Kind {
        TIMEOUT,
        CLIENT_ERROR,
        MAX_RETRIES_EXCEEDED,
        MALFORMED_RESPONSE,
        INTERRUPTED
    }

    public static FetchFailureReason clientError(int statusCode) {
        return new FetchFailureReason(Kind.CLIENT_ERROR, statusCode);
    }

    public boolean isTerminal() {
        return kind == Kind.CLIENT_ERROR || kind == Kind.MALFORMED_RESPONSE;
    }

    public String label() {
        return switch (kind) {
            case TIMEOUT -> "Timeout";
            case CLIENT_ERROR -> "ClientError:" + statusCode;
            case MAX_RETRIES_EXCEEDED -> "MaxRetriesExceeded";
            case MALFORMED_RESPONSE -> "MalformedResponse";
            case INTERRUPTED -> "Interrupted";
        };
    }

    @Override
    public String toString() {
        return label();
    }
}
