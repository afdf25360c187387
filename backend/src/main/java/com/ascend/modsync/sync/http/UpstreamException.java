package com.ascend.modsync.sync.http;

/**
 * Failure reported by the upstream metadata API.
 */
public abstract class UpstreamException extends RuntimeException {
    private final int statusCode;

    protected UpstreamException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public abstract boolean isRetryable();
}
