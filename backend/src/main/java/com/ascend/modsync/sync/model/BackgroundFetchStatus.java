package com.ascend.modsync.sync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BackgroundFetchStatus(
    @JsonProperty("isRunning") boolean isRunning,
    TokenBucketSnapshot tokenBucket,
    boolean canMakeRequest,
    boolean rateLimited
) {
    public static BackgroundFetchStatus from(EngineStatus status) {
        return new BackgroundFetchStatus(
            status.running(),
            status.tokenBucket(),
            status.canMakeRequest(),
            status.rateLimited()
        );
    }
}
