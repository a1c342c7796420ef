package com.delta.factengine.facts.retry;

public record RetryResult<T>(T value, FetchFailureReason failure, int attempts) {
    public static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(value, null, attempts);
    }

    public static <T> RetryResult<T> failure(FetchFailureReason reason, int attempts) {
        return new RetryResult<>(null, reason, attempts);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
