package com.ascend.modsync.sync.service;

import com.ascend.modsync.config.ModSyncProperties;
import com.ascend.modsync.sync.http.CurseForgeModClient;
import com.ascend.modsync.sync.http.UpstreamQuotaTracker;
import com.ascend.modsync.sync.model.FetchOutcome;
import com.ascend.modsync.sync.model.FetchPriority;
import com.ascend.modsync.sync.model.FetchState;
import com.ascend.modsync.sync.model.FetchTicket;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class FetchSchedulerUpstreamQuotaTest {
    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final AtomicLong nanos = new AtomicLong();
    private final ScheduledExecutorService scheduledExecutor = Mockito.mock(ScheduledExecutorService.class);

    private MockWebServer server;
    private ExecutorService httpExecutor;
    private MetadataCache cache;
    private TokenBucket tokenBucket;
    private FetchScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpExecutor = Executors.newFixedThreadPool(1);

        ModSyncProperties properties = new ModSyncProperties();
        properties.getUpstream().setBaseUrl(server.url("/v1").toString());
        properties.getUpstream().setApiKey("test-key");
        properties.getUpstream().setRequestTimeoutSeconds(5);

        UpstreamQuotaTracker quotaTracker = new UpstreamQuotaTracker(clock);
        CurseForgeModClient client = new CurseForgeModClient(properties, new ObjectMapper(), quotaTracker, httpExecutor);
        cache = new MetadataCache(clock, Duration.ofHours(24));
        tokenBucket = new TokenBucket(10, 1.0, nanos::get);
        scheduler = new FetchScheduler(tokenBucket, quotaTracker, cache, client, properties, Runnable::run, scheduledExecutor);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
    }

    @Test
    void exhaustedQuotaReportedByUpstreamBlocksFurtherCallsUntilReset() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("X-RateLimit-Remaining", "0")
            .setHeader("X-RateLimit-Reset", String.valueOf(START.plusSeconds(60).getEpochSecond()))
            .setBody("{\"data\":{\"id\":1,\"name\":\"Dino Tracker\"}}"));

        FetchTicket first = scheduler.requestFetch("1", FetchPriority.ON_DEMAND);
        assertThat(first.outcome()).isEqualTo(FetchOutcome.SUBMITTED);
        assertThat(first.completion().join().fetchState()).isEqualTo(FetchState.FRESH);

        FetchTicket blocked = scheduler.requestFetch("2", FetchPriority.ON_DEMAND);

        assertThat(blocked.outcome()).isEqualTo(FetchOutcome.RATE_LIMITED);
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(tokenBucket.snapshot().tokens()).isEqualTo(9.0);
        assertThat(cache.get("2").consecutiveFailures()).isZero();

        clock.advance(Duration.ofSeconds(61));
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setBody("{\"data\":{\"id\":2,\"name\":\"Better Breeding\"}}"));

        FetchTicket afterReset = scheduler.requestFetch("2", FetchPriority.ON_DEMAND);

        assertThat(afterReset.outcome()).isEqualTo(FetchOutcome.SUBMITTED);
        assertThat(afterReset.completion().join().fetchState()).isEqualTo(FetchState.FRESH);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }
}
