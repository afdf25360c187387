package com.ascend.modsync.sync.api;

public record BackgroundFetchActionRequest(
    String action
) {
}
