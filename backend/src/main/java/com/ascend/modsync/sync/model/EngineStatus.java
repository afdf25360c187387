package com.ascend.modsync.sync.model;

public record EngineStatus(
    boolean running,
    TokenBucketSnapshot tokenBucket,
    boolean canMakeRequest,
    boolean rateLimited,
    int trackedKeys,
    int inFlight
) {
}
