package com.ascend.modsync.sync.service;

import com.ascend.modsync.config.ModSyncProperties;
import com.ascend.modsync.sync.http.ModMetadataClient;
import com.ascend.modsync.sync.http.UpstreamException;
import com.ascend.modsync.sync.http.UpstreamQuotaTracker;
import com.ascend.modsync.sync.http.UpstreamRateLimitedException;
import com.ascend.modsync.sync.model.FailureKind;
import com.ascend.modsync.sync.model.FetchOutcome;
import com.ascend.modsync.sync.model.FetchPriority;
import com.ascend.modsync.sync.model.FetchTicket;
import com.ascend.modsync.sync.model.ModRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admission, single-flight and retry engine for upstream metadata fetches.
 *
 * <p>On-demand and background requests go through the same non-blocking token check; there
 * is no queue. The in-flight map doubles as the pending set: a key is present at most once,
 * from admission until its attempt has been written back to the cache. Only bookkeeping runs
 * on the caller's thread, the upstream call itself runs on the fetch executor.
 */
@Service
public class FetchScheduler {
    private static final Logger log = LoggerFactory.getLogger(FetchScheduler.class);
    private static final int MAX_ERROR_LENGTH = 500;
    private static final int MAX_BACKOFF_SHIFT = 30;

    private final TokenBucket tokenBucket;
    private final UpstreamQuotaTracker quotaTracker;
    private final MetadataCache cache;
    private final ModMetadataClient client;
    private final ModSyncProperties.Scheduler settings;
    private final Executor fetchExecutor;
    private final ScheduledExecutorService scheduler;

    private final Map<String, CompletableFuture<ModRecord>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pendingRetries = new ConcurrentHashMap<>();
    private final AtomicBoolean lastAdmissionDenied = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private volatile boolean running;
    private ScheduledFuture<?> sweepTask;

    public FetchScheduler(
        TokenBucket tokenBucket,
        UpstreamQuotaTracker quotaTracker,
        MetadataCache cache,
        ModMetadataClient client,
        ModSyncProperties properties,
        @Qualifier("fetchExecutor") Executor fetchExecutor,
        @Qualifier("syncScheduler") ScheduledExecutorService scheduler
    ) {
        this.tokenBucket = tokenBucket;
        this.quotaTracker = quotaTracker;
        this.cache = cache;
        this.client = client;
        this.settings = properties.getScheduler();
        this.fetchExecutor = fetchExecutor;
        this.scheduler = scheduler;
    }

    public FetchTicket requestFetch(String key, FetchPriority priority) {
        ModRecord current = cache.register(key);
        String normalized = current.key();

        CompletableFuture<ModRecord> completion = new CompletableFuture<>();
        CompletableFuture<ModRecord> existing = inFlight.putIfAbsent(normalized, completion);
        if (existing != null) {
            return new FetchTicket(normalized, FetchOutcome.ALREADY_IN_FLIGHT, existing);
        }

        boolean quotaExhausted = quotaTracker.isExhausted();
        boolean admitted = !quotaExhausted && tokenBucket.tryAcquire();
        lastAdmissionDenied.set(!admitted);
        if (!admitted) {
            inFlight.remove(normalized, completion);
            completion.complete(cache.get(normalized));
            log.debug("Admission denied for mod {} ({}, {})", normalized, priority,
                quotaExhausted ? "upstream quota exhausted" : "token bucket empty");
            return new FetchTicket(normalized, FetchOutcome.RATE_LIMITED, completion);
        }

        try {
            fetchExecutor.execute(() -> runFetch(normalized, priority, completion));
        } catch (RejectedExecutionException e) {
            inFlight.remove(normalized, completion);
            completion.complete(cache.get(normalized));
            log.warn("Fetch executor rejected mod {}", normalized);
            return new FetchTicket(normalized, FetchOutcome.REJECTED, completion);
        }
        return new FetchTicket(normalized, FetchOutcome.SUBMITTED, completion);
    }

    public void startBackgroundLoop() {
        startBackgroundLoop(Duration.ofSeconds(settings.getSweepIntervalSeconds()));
    }

    public void startBackgroundLoop(Duration interval) {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            long intervalMs = Math.max(1L, interval.toMillis());
            running = true;
            sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, 0L, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Started background mod sync (interval={}ms)", intervalMs);
        }
    }

    public void stopBackgroundLoop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            if (sweepTask != null) {
                sweepTask.cancel(false);
                sweepTask = null;
            }
            pendingRetries.values().forEach(retry -> retry.cancel(false));
            pendingRetries.clear();
            log.info("Stopped background mod sync ({} fetches still in flight)", inFlight.size());
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isInFlight(String key) {
        return key != null && inFlight.containsKey(key.trim());
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public boolean lastAdmissionDenied() {
        return lastAdmissionDenied.get();
    }

    public boolean upstreamQuotaExhausted() {
        return quotaTracker.isExhausted();
    }

    /**
     * One pass of the background refresh. Stops issuing requests as soon as the bucket
     * holds less than one token so keys are not cycled through pending-then-denied.
     */
    void sweep() {
        if (!running) {
            return;
        }
        int issued = 0;
        try {
            Instant now = cache.now();
            Iterator<String> staleKeys = cache.listStale(now, inFlight::containsKey).iterator();
            while (running && staleKeys.hasNext()) {
                if (tokenBucket.snapshot().tokens() < 1) {
                    log.debug("Sweep paused: token budget exhausted after {} requests", issued);
                    break;
                }
                if (quotaTracker.isExhausted()) {
                    log.debug("Sweep paused: upstream quota exhausted after {} requests", issued);
                    break;
                }
                String key = staleKeys.next();
                if (!eligibleForBackground(cache.get(key))) {
                    continue;
                }
                if (requestFetch(key, FetchPriority.BACKGROUND).admitted()) {
                    issued++;
                }
            }
        } catch (Exception e) {
            log.warn("Background sweep failed after {} requests", issued, e);
        }
        if (issued > 0) {
            log.debug("Sweep issued {} background fetches", issued);
        }
    }

    boolean eligibleForBackground(ModRecord record) {
        if (record == null) {
            return false;
        }
        if (record.lastErrorKind() == FailureKind.PERMANENT) {
            return false;
        }
        return record.consecutiveFailures() <= settings.getMaxRetries();
    }

    Duration backoffFor(int consecutiveFailures, Duration retryAfter) {
        long baseMs = settings.getRetryBaseDelayMs();
        long maxMs = settings.getRetryMaxDelayMs();
        int shift = Math.max(0, Math.min(consecutiveFailures, MAX_BACKOFF_SHIFT));
        long delayMs = Math.min(maxMs, baseMs * (1L << shift));
        if (retryAfter != null) {
            delayMs = Math.min(maxMs, Math.max(delayMs, retryAfter.toMillis()));
        }
        return Duration.ofMillis(delayMs);
    }

    private void runFetch(String key, FetchPriority priority, CompletableFuture<ModRecord> completion) {
        FailureOutcome failure = null;
        ModRecord result = null;
        try {
            JsonNode payload = client.fetchOne(key);
            if (payload == null) {
                failure = recordFailure(key, "empty payload from upstream", FailureKind.PERMANENT, null);
            } else {
                result = cache.upsertSuccess(key, payload);
                log.debug("Fetched mod {} ({})", key, priority);
            }
        } catch (UpstreamRateLimitedException e) {
            failure = recordFailure(key, e.getMessage(), FailureKind.TRANSIENT, e.retryAfter());
        } catch (UpstreamException e) {
            FailureKind kind = e.isRetryable() ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
            failure = recordFailure(key, e.getMessage(), kind, null);
        } catch (Exception e) {
            failure = recordFailure(key, "exception=" + e.getClass().getSimpleName(), FailureKind.TRANSIENT, null);
        } finally {
            // the key must leave the pending set before its retry can be admitted
            inFlight.remove(key, completion);
            if (failure != null) {
                result = failure.record();
                if (failure.retryDelay() != null) {
                    scheduleRetry(key, failure.retryDelay());
                }
            }
            completion.complete(result == null ? cache.get(key) : result);
        }
    }

    private FailureOutcome recordFailure(String key, String error, FailureKind kind, Duration retryAfter) {
        ModRecord previous = cache.get(key);
        int failures = (previous == null ? 0 : previous.consecutiveFailures()) + 1;
        boolean retry = kind == FailureKind.TRANSIENT && running && failures <= settings.getMaxRetries();
        Duration delay = retry ? backoffFor(failures, retryAfter) : null;
        Instant retryAt = delay == null ? null : cache.now().plus(delay);

        ModRecord failed = cache.markFailed(key, truncate(error), kind, retryAt);
        if (delay != null) {
            log.warn("Fetch for mod {} failed ({} consecutive), retrying in {}ms: {}",
                key, failed.consecutiveFailures(), delay.toMillis(), error);
        } else {
            log.warn("Fetch for mod {} failed ({} consecutive, {}), no automatic retry: {}",
                key, failed.consecutiveFailures(), kind, error);
        }
        return new FailureOutcome(failed, delay);
    }

    private void scheduleRetry(String key, Duration delay) {
        try {
            ScheduledFuture<?> retry = scheduler.schedule(() -> {
                pendingRetries.remove(key);
                if (running) {
                    requestFetch(key, FetchPriority.BACKGROUND);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
            if (retry != null) {
                ScheduledFuture<?> replaced = pendingRetries.put(key, retry);
                if (replaced != null) {
                    replaced.cancel(false);
                }
            }
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule retry for mod {}; the next sweep will pick it up", key);
        }
    }

    private String truncate(String error) {
        if (error == null) {
            return "unknown_error";
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    private record FailureOutcome(ModRecord record, Duration retryDelay) {
    }
}
