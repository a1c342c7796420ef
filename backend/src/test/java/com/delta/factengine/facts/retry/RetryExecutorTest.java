package com.delta.factengine.facts.retry;

import com.delta.factengine.facts.http.FetchStatusException;
import com.delta.factengine.facts.http.FetchTerminalException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RetryExecutorTest {
    private ExecutorService executor;
    private RetryExecutor retryExecutor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        retryExecutor = new RetryExecutor(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void succeedsAfterTransientServerErrors() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(5), Duration.ofSeconds(2));

        RetryResult<String> result = retryExecutor.executeDetailed("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new FetchStatusException(500, "http://example.test");
            }
            return "ok";
        }, policy);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.value()).isEqualTo("ok");
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void clientErrorIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(5), Duration.ofSeconds(2));

        RetryResult<String> result = retryExecutor.executeDetailed("test", () -> {
            calls.incrementAndGet();
            throw new FetchStatusException(404, "http://example.test/missing");
        }, policy);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.failure().label()).isEqualTo("ClientError:404");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void rateLimitIsRetried() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(1, Duration.ofMillis(1), Duration.ofSeconds(2));

        String value = retryExecutor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new FetchStatusException(429, "http://example.test");
            }
            return "after-backoff";
        }, policy);

        assertThat(value).isEqualTo("after-backoff");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void exhaustedRetriesReturnNull() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(2, Duration.ZERO, Duration.ofSeconds(2));

        RetryResult<String> result = retryExecutor.executeDetailed("test", () -> {
            calls.incrementAndGet();
            throw new IOException("connection reset");
        }, policy);

        assertThat(result.value()).isNull();
        assertThat(result.failure()).isEqualTo(FetchFailureReason.MAX_RETRIES_EXCEEDED);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void malformedResponseIsTerminal() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ofSeconds(2));

        RetryResult<Object> result = retryExecutor.executeDetailed("test", () -> {
            calls.incrementAndGet();
            throw new FetchTerminalException("not json");
        }, policy);

        assertThat(result.failure().label()).isEqualTo("MalformedResponse");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void timedOutAttemptIsInterruptedAndReportedAsTimeout() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicBoolean finishedNormally = new AtomicBoolean(false);
        RetryPolicy policy = new RetryPolicy(0, Duration.ZERO, Duration.ofMillis(100));

        RetryResult<String> result = retryExecutor.executeDetailed("slow", () -> {
            try {
                Thread.sleep(10_000);
                finishedNormally.set(true);
                return "late";
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        }, policy);

        assertThat(result.failure()).isEqualTo(FetchFailureReason.TIMEOUT);
        assertThat(result.failure().label()).isEqualTo("Timeout");
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(finishedNormally.get()).isFalse();
    }

    @Test
    void backoffGrowsExponentiallyWithBoundedJitter() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1));
        for (int attempt = 0; attempt < 3; attempt++) {
            long expectedBase = 100L << attempt;
            long delay = retryExecutor.backoffDelayMs(attempt, policy);
            assertThat(delay).isBetween(expectedBase, expectedBase + 99);
        }
    }
}
