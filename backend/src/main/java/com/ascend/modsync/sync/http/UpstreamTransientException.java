package com.ascend.modsync.sync.http;

public class UpstreamTransientException extends UpstreamException {
    public UpstreamTransientException(String message, int statusCode) {
        super(message, statusCode);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
