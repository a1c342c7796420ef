package com.delta.factengine.facts.http;

import com.delta.factengine.config.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Single-attempt HTTP GET with a global concurrency cap and a per-host politeness delay.
 * Retrying is left to the caller's {@code RetryExecutor}.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final Duration RATE_LIMIT_BACKOFF = Duration.ofSeconds(30);

    private final EngineProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        EngineProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) throws InterruptedException {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        globalLimiter.acquire();
        try {
            enforcePerHostDelay(host);
            String accept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", accept)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 429) {
                log.warn("Rate limited by {}; backing off {}s", host, RATE_LIMIT_BACKOFF.toSeconds());
                extendBackoff(host, RATE_LIMIT_BACKOFF);
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } finally {
            globalLimiter.release();
        }
    }

    /**
     * Fetches {@code url} and returns the body of a 2xx response.
     *
     * @throws FetchStatusException on a non-2xx status
     * @throws IOException on transport failures and timeouts
     */
    public String fetchBody(String url, String acceptHeader) throws IOException, InterruptedException {
        HttpFetchResult result = get(url, acceptHeader);
        if (result.errorCode() != null) {
            if (result.isTimeout()) {
                throw new HttpTimeoutException("Timed out fetching " + url);
            }
            if ("invalid_url".equals(result.errorCode())) {
                throw new FetchTerminalException("Invalid URL " + url);
            }
            throw new IOException(result.errorCode() + ": " + result.errorMessage());
        }
        if (!result.isSuccessful()) {
            throw new FetchStatusException(result.statusCode(), result.finalUrlOrRequested());
        }
        return result.body();
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
