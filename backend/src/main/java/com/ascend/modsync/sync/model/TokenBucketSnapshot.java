package com.ascend.modsync.sync.model;

public record TokenBucketSnapshot(
    double tokens,
    int capacity,
    double refillRatePerSecond
) {
}
