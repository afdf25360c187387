package com.ascend.modsync.sync.service;

import com.ascend.modsync.sync.model.TokenBucketSnapshot;

import java.util.function.LongSupplier;

/**
 * Shared request budget for the upstream API.
 *
 * <p>Tokens refill continuously at {@code refillRatePerSecond}, computed lazily from the
 * elapsed monotonic time on every access. Admission never blocks: {@link #tryAcquire(int)}
 * either takes the tokens or leaves the bucket untouched.
 */
public class TokenBucket {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0d;

    private final int capacity;
    private final double refillRatePerSecond;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(int capacity, double refillRatePerSecond) {
        this(capacity, refillRatePerSecond, System::nanoTime);
    }

    public TokenBucket(int capacity, double refillRatePerSecond, LongSupplier nanoClock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (!(refillRatePerSecond > 0)) {
            throw new IllegalArgumentException("refillRatePerSecond must be positive");
        }
        this.capacity = capacity;
        this.refillRatePerSecond = refillRatePerSecond;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public boolean tryAcquire() {
        return tryAcquire(1);
    }

    public synchronized boolean tryAcquire(int cost) {
        if (cost < 1) {
            throw new IllegalArgumentException("cost must be at least 1");
        }
        refill();
        if (tokens >= cost) {
            tokens -= cost;
            return true;
        }
        return false;
    }

    public synchronized TokenBucketSnapshot snapshot() {
        refill();
        return new TokenBucketSnapshot(tokens, capacity, refillRatePerSecond);
    }

    public int capacity() {
        return capacity;
    }

    public double refillRatePerSecond() {
        return refillRatePerSecond;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * refillRatePerSecond);
        lastRefillNanos = now;
    }
}
