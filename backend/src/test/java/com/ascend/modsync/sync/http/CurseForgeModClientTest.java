package com.ascend.modsync.sync.http;

import com.ascend.modsync.config.ModSyncProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CurseForgeModClientTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private MockWebServer server;
    private ExecutorService executor;
    private ModSyncProperties properties;
    private UpstreamQuotaTracker quotaTracker;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new ModSyncProperties();
        properties.getUpstream().setBaseUrl(server.url("/v1").toString());
        properties.getUpstream().setApiKey("test-key");
        properties.getUpstream().setRequestTimeoutSeconds(5);
        quotaTracker = new UpstreamQuotaTracker(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void returnsDataNodeAndSendsApiKey() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"data\":{\"id\":928793,\"name\":\"Cybers Structures QoL+\"}}"));

        JsonNode data = newClient().fetchOne("928793");

        assertThat(data.get("id").asLong()).isEqualTo(928793L);
        assertThat(data.get("name").asText()).isEqualTo("Cybers Structures QoL+");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/mods/928793");
        assertThat(request.getHeader("x-api-key")).isEqualTo("test-key");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
        assertThat(request.getHeader("User-Agent")).startsWith("ascend-mod-sync/0.1");
    }

    @Test
    void rateLimitHeadersUpdateUpstreamQuota() throws Exception {
        long reset = NOW.plusSeconds(60).getEpochSecond();
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("X-RateLimit-Remaining", "0")
            .setHeader("X-RateLimit-Reset", String.valueOf(reset))
            .setBody("{\"data\":{\"id\":1}}"));

        newClient().fetchOne("1");

        assertThat(quotaTracker.isExhausted()).isTrue();
        assertThat(quotaTracker.current().remaining()).isZero();
        assertThat(quotaTracker.current().resetAt()).isEqualTo(Instant.ofEpochSecond(reset));
    }

    @Test
    void quotaIsTrackedOnErrorResponsesAndIgnoredWhenIncomplete() {
        server.enqueue(new MockResponse()
            .setResponseCode(503)
            .setHeader("X-RateLimit-Remaining", "12")
            .setHeader("X-RateLimit-Reset", String.valueOf(NOW.plusSeconds(60).getEpochSecond())));
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("X-RateLimit-Remaining", "0")
            .setBody("{\"data\":{\"id\":2}}"));

        assertThatThrownBy(() -> newClient().fetchOne("1")).isInstanceOf(UpstreamTransientException.class);
        assertThat(quotaTracker.current().remaining()).isEqualTo(12);

        newClient().fetchOne("2");
        assertThat(quotaTracker.current().remaining()).isEqualTo(12);
        assertThat(quotaTracker.isExhausted()).isFalse();
    }

    @Test
    void notFoundIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":\"not found\"}"));

        assertThatThrownBy(() -> newClient().fetchOne("1"))
            .isInstanceOf(UpstreamPermanentException.class)
            .hasMessageContaining("HTTP_404")
            .satisfies(e -> assertThat(((UpstreamException) e).statusCode()).isEqualTo(404));
    }

    @Test
    void unauthorizedIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(403));

        assertThatThrownBy(() -> newClient().fetchOne("1"))
            .isInstanceOf(UpstreamPermanentException.class)
            .hasMessageContaining("HTTP_401_403");
    }

    @Test
    void tooManyRequestsCarriesRetryAfter() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7"));

        assertThatThrownBy(() -> newClient().fetchOne("1"))
            .isInstanceOfSatisfying(UpstreamRateLimitedException.class, e -> {
                assertThat(e.retryAfter()).isEqualTo(Duration.ofSeconds(7));
                assertThat(e.isRetryable()).isTrue();
            });
    }

    @Test
    void serverErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));

        assertThatThrownBy(() -> newClient().fetchOne("1"))
            .isInstanceOf(UpstreamTransientException.class)
            .hasMessageContaining("HTTP_5XX");
    }

    @Test
    void responseWithoutDataIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"pagination\":{}}"));

        assertThatThrownBy(() -> newClient().fetchOne("1"))
            .isInstanceOf(UpstreamPermanentException.class)
            .hasMessageContaining("PARSING_FAILED");
    }

    @Test
    void missingApiKeyFailsWithoutCallingUpstream() {
        properties.getUpstream().setApiKey("  ");

        assertThatThrownBy(() -> newClient().fetchOne("1"))
            .isInstanceOf(UpstreamPermanentException.class)
            .hasMessageContaining("MISSING_API_KEY");
        assertThat(server.getRequestCount()).isZero();
    }

    private CurseForgeModClient newClient() {
        return new CurseForgeModClient(properties, new ObjectMapper(), quotaTracker, executor);
    }
}
