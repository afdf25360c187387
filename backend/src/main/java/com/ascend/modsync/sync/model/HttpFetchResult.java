package com.ascend.modsync.sync.model;

import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String retryAfter,
    Integer rateLimitRemaining,
    Instant rateLimitReset,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
