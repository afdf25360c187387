package com.ascend.modsync.sync.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Cached metadata for one upstream key. Instances are immutable; the cache replaces
 * them atomically on every fetch attempt.
 */
public record ModRecord(
    String key,
    JsonNode payload,
    FetchState fetchState,
    Instant lastFetchedAt,
    Instant staleAfter,
    String lastError,
    FailureKind lastErrorKind,
    int consecutiveFailures,
    Instant retryNotBefore
) {
    public static ModRecord pending(String key, Instant now) {
        return new ModRecord(key, null, FetchState.PENDING, null, now, null, null, 0, null);
    }

    public boolean hasPayload() {
        return payload != null;
    }

    public boolean isStaleAt(Instant now) {
        return staleAfter == null || !staleAfter.isAfter(now);
    }

    /**
     * A stored FRESH record past its staleness deadline reads as STALE.
     */
    public ModRecord resolvedAt(Instant now) {
        if (fetchState == FetchState.FRESH && isStaleAt(now)) {
            return withState(FetchState.STALE);
        }
        return this;
    }

    public ModRecord withState(FetchState state) {
        return new ModRecord(
            key,
            payload,
            state,
            lastFetchedAt,
            staleAfter,
            lastError,
            lastErrorKind,
            consecutiveFailures,
            retryNotBefore
        );
    }
}
