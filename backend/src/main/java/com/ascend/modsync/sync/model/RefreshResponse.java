package com.ascend.modsync.sync.model;

public record RefreshResponse(
    String key,
    FetchOutcome outcome
) {
}
