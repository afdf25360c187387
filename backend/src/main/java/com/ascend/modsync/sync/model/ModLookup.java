package com.ascend.modsync.sync.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record ModLookup(
    String key,
    JsonNode payload,
    FetchState fetchState,
    boolean pending,
    Instant lastFetchedAt,
    Instant staleAfter,
    String lastError
) {
}
