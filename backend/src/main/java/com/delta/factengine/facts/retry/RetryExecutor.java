package com.delta.factengine.facts.retry;

import com.delta.factengine.facts.http.FetchStatusException;
import com.delta.factengine.facts.http.FetchTerminalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a fallible operation with a per-attempt timeout and exponential backoff with jitter.
 *
 * <p>Each attempt runs on the {@code fetchAttemptExecutor} pool and is cancelled with interruption
 * when its timeout expires. HTTP 4xx responses other than 429 and {@link FetchTerminalException}
 * end the loop immediately. Failures are logged and reported, never thrown.
 */
@Component
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ExecutorService attemptExecutor;

    public RetryExecutor(@Qualifier("fetchAttemptExecutor") ExecutorService attemptExecutor) {
        this.attemptExecutor = attemptExecutor;
    }

    public <T> T execute(Callable<T> operation, RetryPolicy policy) {
        return execute("operation", operation, policy);
    }

    public <T> T execute(String label, Callable<T> operation, RetryPolicy policy) {
        return executeDetailed(label, operation, policy).value();
    }

    public <T> RetryResult<T> executeDetailed(String label, Callable<T> operation, RetryPolicy policy) {
        int maxAttempts = policy.maxAttempts();
        FetchFailureReason lastReason = FetchFailureReason.MAX_RETRIES_EXCEEDED;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            int attemptNumber = attempt + 1;
            Future<T> future;
            try {
                future = attemptExecutor.submit(operation);
            } catch (RejectedExecutionException e) {
                log.warn("{}: attempt {} rejected, executor is shutting down", label, attemptNumber);
                return RetryResult.failure(FetchFailureReason.INTERRUPTED, attempt);
            }
            try {
                T value = future.get(policy.timeout().toMillis(), TimeUnit.MILLISECONDS);
                if (attempt > 0) {
                    log.info("{}: succeeded on attempt {}/{}", label, attemptNumber, maxAttempts);
                }
                return RetryResult.success(value, attemptNumber);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastReason = FetchFailureReason.TIMEOUT;
                log.warn("{}: attempt {}/{} timed out after {} ms",
                    label, attemptNumber, maxAttempts, policy.timeout().toMillis());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                FetchFailureReason terminal = terminalReason(cause);
                if (terminal != null) {
                    log.warn("{}: attempt {}/{} failed with non-retryable {} ({})",
                        label, attemptNumber, maxAttempts, terminal.label(), cause.getMessage());
                    return RetryResult.failure(terminal, attemptNumber);
                }
                lastReason = FetchFailureReason.MAX_RETRIES_EXCEEDED;
                log.warn("{}: attempt {}/{} failed: {}", label, attemptNumber, maxAttempts, describe(cause));
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                log.warn("{}: interrupted during attempt {}", label, attemptNumber);
                return RetryResult.failure(FetchFailureReason.INTERRUPTED, attemptNumber);
            }

            if (attemptNumber < maxAttempts && !sleepBackoff(attempt, policy)) {
                log.warn("{}: interrupted while backing off", label);
                return RetryResult.failure(FetchFailureReason.INTERRUPTED, attemptNumber);
            }
        }
        FetchFailureReason reason = lastReason == FetchFailureReason.TIMEOUT
            ? FetchFailureReason.TIMEOUT
            : FetchFailureReason.MAX_RETRIES_EXCEEDED;
        log.error("{}: giving up after {} attempts ({})", label, maxAttempts, reason.label());
        return RetryResult.failure(reason, maxAttempts);
    }

    long backoffDelayMs(int attempt, RetryPolicy policy) {
        long base = policy.baseDelay().toMillis();
        if (base <= 0) {
            return 0L;
        }
        long exponential = base * (1L << Math.min(20, Math.max(0, attempt)));
        return exponential + ThreadLocalRandom.current().nextLong(base);
    }

    private boolean sleepBackoff(int attempt, RetryPolicy policy) {
        long delay = backoffDelayMs(attempt, policy);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private FetchFailureReason terminalReason(Throwable cause) {
        if (cause instanceof FetchStatusException status && status.isClientError() && status.getStatusCode() != 429) {
            return FetchFailureReason.clientError(status.getStatusCode());
        }
        if (cause instanceof FetchTerminalException) {
            return FetchFailureReason.MALFORMED_RESPONSE;
        }
        return null;
    }

    private String describe(Throwable cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
