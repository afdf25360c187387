package com.ascend.modsync.sync.http;

import com.ascend.modsync.sync.model.UpstreamQuota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers the quota upstream reported on its last response so callers can stop
 * spending requests the server would reject anyway.
 */
public class UpstreamQuotaTracker {
    private static final Logger log = LoggerFactory.getLogger(UpstreamQuotaTracker.class);

    private final Clock clock;
    private final AtomicReference<UpstreamQuota> latest = new AtomicReference<>();

    public UpstreamQuotaTracker(Clock clock) {
        this.clock = clock;
    }

    public void update(Integer remaining, Instant resetAt) {
        if (remaining == null || resetAt == null) {
            return;
        }
        UpstreamQuota quota = new UpstreamQuota(remaining, resetAt);
        UpstreamQuota previous = latest.getAndSet(quota);
        if (quota.isExhaustedAt(clock.instant()) && (previous == null || previous.remaining() > 0)) {
            log.warn("Upstream quota exhausted until {}", resetAt);
        }
    }

    public boolean isExhausted() {
        UpstreamQuota quota = latest.get();
        return quota != null && quota.isExhaustedAt(clock.instant());
    }

    public UpstreamQuota current() {
        return latest.get();
    }

    public static Integer parseRemaining(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(header.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** {@code X-RateLimit-Reset} carries epoch seconds. */
    public static Instant parseReset(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
