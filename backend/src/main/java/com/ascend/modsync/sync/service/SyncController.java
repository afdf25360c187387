package com.ascend.modsync.sync.service;

import com.ascend.modsync.config.ModSyncProperties;
import com.ascend.modsync.sync.model.EngineStatus;
import com.ascend.modsync.sync.model.FailureKind;
import com.ascend.modsync.sync.model.FetchPriority;
import com.ascend.modsync.sync.model.FetchState;
import com.ascend.modsync.sync.model.FetchTicket;
import com.ascend.modsync.sync.model.ModLookup;
import com.ascend.modsync.sync.model.ModRecord;
import com.ascend.modsync.sync.model.TokenBucketSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Collection;

/**
 * Entry point for callers that need mod metadata or control over the background refresh.
 * Reads never wait on the network: they return whatever the cache holds and, when that
 * is stale or missing, kick off an on-demand fetch.
 */
@Service
public class SyncController {
    private static final Logger log = LoggerFactory.getLogger(SyncController.class);

    private final FetchScheduler scheduler;
    private final MetadataCache cache;
    private final TokenBucket tokenBucket;
    private final ModSyncProperties properties;

    public SyncController(
        FetchScheduler scheduler,
        MetadataCache cache,
        TokenBucket tokenBucket,
        ModSyncProperties properties
    ) {
        this.scheduler = scheduler;
        this.cache = cache;
        this.tokenBucket = tokenBucket;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        int seeded = track(properties.getDaemon().getSeedModIds());
        if (seeded > 0) {
            log.info("Tracking {} seeded mod ids", seeded);
        }
        if (properties.getDaemon().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public ModLookup getOrRefresh(String key) {
        Instant now = cache.now();
        ModRecord record = cache.get(key);
        if (needsRefresh(record)) {
            scheduler.requestFetch(key, FetchPriority.ON_DEMAND);
            record = cache.get(key);
        }
        return toLookup(key, record, now);
    }

    /**
     * Reads re-attempt anything that is missing, stale or transiently failed. A permanent
     * failure is left alone until an explicit {@link #refresh(String)}.
     */
    private static boolean needsRefresh(ModRecord record) {
        if (record == null) {
            return true;
        }
        if (record.lastErrorKind() == FailureKind.PERMANENT) {
            return false;
        }
        return record.fetchState() != FetchState.FRESH;
    }

    public FetchTicket refresh(String key) {
        return scheduler.requestFetch(key, FetchPriority.ON_DEMAND);
    }

    public ModRecord record(String key) {
        return cache.get(key);
    }

    public int track(Collection<String> keys) {
        if (keys == null) {
            return 0;
        }
        int tracked = 0;
        for (String key : keys) {
            if (key == null || key.isBlank()) {
                continue;
            }
            cache.register(key);
            tracked++;
        }
        return tracked;
    }

    public void start() {
        scheduler.startBackgroundLoop();
    }

    public void stop() {
        scheduler.stopBackgroundLoop();
    }

    public EngineStatus status() {
        TokenBucketSnapshot snapshot = tokenBucket.snapshot();
        return new EngineStatus(
            scheduler.isRunning(),
            snapshot,
            snapshot.tokens() >= 1,
            scheduler.lastAdmissionDenied() || scheduler.upstreamQuotaExhausted(),
            cache.size(),
            scheduler.inFlightCount()
        );
    }

    private ModLookup toLookup(String key, ModRecord record, Instant now) {
        if (record == null) {
            return new ModLookup(key, null, null, true, null, null, null);
        }
        boolean pending = !record.hasPayload() || scheduler.isInFlight(record.key());
        ModRecord resolved = record.resolvedAt(now);
        return new ModLookup(
            record.key(),
            record.payload(),
            resolved.fetchState(),
            pending,
            record.lastFetchedAt(),
            record.staleAfter(),
            record.lastError()
        );
    }
}
