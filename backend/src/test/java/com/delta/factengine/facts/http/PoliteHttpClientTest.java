package com.delta.factengine.facts.http;

import com.delta.factengine.config.EngineProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoliteHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);

        EngineProperties properties = new EngineProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setUserAgent("fact-engine-test/1.0");
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void successfulGetCarriesBodyAndHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"ok\":true}"));

        HttpFetchResult result = client.get(server.url("/ok").toString(), "application/json");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("{\"ok\":true}");
        assertThat(result.contentType()).startsWith("application/json");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo("fact-engine-test/1.0");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void fetchBodyRaisesStatusExceptionForServerError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("down"));
        String url = server.url("/down").toString();

        assertThatThrownBy(() -> client.fetchBody(url, null))
            .isInstanceOf(FetchStatusException.class)
            .satisfies(e -> {
                FetchStatusException status = (FetchStatusException) e;
                assertThat(status.getStatusCode()).isEqualTo(503);
                assertThat(status.isClientError()).isFalse();
            });
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void clientErrorIsFlagged() {
        server.enqueue(new MockResponse().setResponseCode(404));
        String url = server.url("/missing").toString();

        assertThatThrownBy(() -> client.fetchBody(url, "text/html"))
            .isInstanceOf(FetchStatusException.class)
            .satisfies(e -> assertThat(((FetchStatusException) e).isClientError()).isTrue());
    }

    @Test
    void malformedUrlIsTerminal() throws Exception {
        HttpFetchResult result = client.get("http://", "text/html");
        assertThat(result.errorCode()).isEqualTo("invalid_url");

        assertThatThrownBy(() -> client.fetchBody("   ", "text/html"))
            .isInstanceOf(FetchTerminalException.class);
        assertThat(server.getRequestCount()).isZero();
    }
}
