package com.ascend.modsync.sync.http;

public class UpstreamPermanentException extends UpstreamException {
    public UpstreamPermanentException(String message, int statusCode) {
        super(message, statusCode);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
