package com.ascend.modsync.sync.model;

import java.time.Instant;

/**
 * Request quota last reported by upstream through its rate-limit headers.
 */
public record UpstreamQuota(int remaining, Instant resetAt) {
    public boolean isExhaustedAt(Instant now) {
        return remaining <= 0 && now.isBefore(resetAt);
    }
}
