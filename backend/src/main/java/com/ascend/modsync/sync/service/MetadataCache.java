package com.ascend.modsync.sync.service;

import com.ascend.modsync.sync.model.FailureKind;
import com.ascend.modsync.sync.model.FetchState;
import com.ascend.modsync.sync.model.ModRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * In-memory store of fetched mod metadata keyed by upstream id.
 *
 * <p>Every mutation is a single atomic {@code compute} on the key, so concurrent writers
 * for the same key are serialized while different keys never contend. A failed refresh
 * keeps the last known-good payload.
 */
public class MetadataCache {
    private final Map<String, ModRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;

    public MetadataCache(Clock clock, Duration defaultTtl) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    public ModRecord get(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        ModRecord record = records.get(key.trim());
        return record == null ? null : record.resolvedAt(clock.instant());
    }

    public ModRecord register(String key) {
        Instant now = clock.instant();
        return records.computeIfAbsent(requireKey(key), k -> ModRecord.pending(k, now)).resolvedAt(now);
    }

    public ModRecord upsertSuccess(String key, JsonNode payload) {
        return upsertSuccess(key, payload, defaultTtl);
    }

    public ModRecord upsertSuccess(String key, JsonNode payload, Duration ttl) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        Instant now = clock.instant();
        Duration safeTtl = ttl == null || ttl.isNegative() ? defaultTtl : ttl;
        return records.compute(requireKey(key), (k, existing) -> new ModRecord(
            k,
            payload,
            FetchState.FRESH,
            now,
            now.plus(safeTtl),
            null,
            null,
            0,
            null
        ));
    }

    public ModRecord markFailed(String key, String error) {
        return markFailed(key, error, FailureKind.TRANSIENT, null);
    }

    public ModRecord markFailed(String key, String error, FailureKind kind, Instant retryNotBefore) {
        Instant now = clock.instant();
        return records.compute(requireKey(key), (k, existing) -> {
            ModRecord base = existing == null ? ModRecord.pending(k, now) : existing;
            boolean hasPayload = base.hasPayload();
            Instant staleAfter = base.staleAfter() == null || base.staleAfter().isAfter(now)
                ? now
                : base.staleAfter();
            return new ModRecord(
                k,
                base.payload(),
                hasPayload ? FetchState.STALE : FetchState.FAILED,
                base.lastFetchedAt(),
                staleAfter,
                error,
                kind,
                base.consecutiveFailures() + 1,
                retryNotBefore
            );
        });
    }

    /**
     * Keys due for refresh at {@code now}: past their staleness deadline, not owned by a
     * pending backoff retry, and not currently in flight. The stream is built fresh on
     * every call and reads the live map lazily.
     */
    public Stream<String> listStale(Instant now, Predicate<String> inFlight) {
        Predicate<String> excluded = inFlight == null ? key -> false : inFlight;
        return records.values().stream()
            .filter(record -> record.isStaleAt(now))
            .filter(record -> record.retryNotBefore() == null || !record.retryNotBefore().isAfter(now))
            .map(ModRecord::key)
            .filter(excluded.negate());
    }

    public Stream<String> listStale(Instant now) {
        return listStale(now, null);
    }

    public List<String> keys() {
        return List.copyOf(records.keySet());
    }

    public int size() {
        return records.size();
    }

    public Instant now() {
        return clock.instant();
    }

    private String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        return key.trim();
    }
}
