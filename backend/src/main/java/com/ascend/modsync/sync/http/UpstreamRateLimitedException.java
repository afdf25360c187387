package com.ascend.modsync.sync.http;

import java.time.Duration;

/**
 * Upstream answered 429. {@code retryAfter} is the server's hint, or null when absent.
 */
public class UpstreamRateLimitedException extends UpstreamTransientException {
    private final Duration retryAfter;

    public UpstreamRateLimitedException(Duration retryAfter) {
        super("Rate limit exceeded. Please wait before making more requests.", 429);
        this.retryAfter = retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
