package com.ascend.modsync.sync.model;

public enum FetchState {
    PENDING,
    FRESH,
    STALE,
    FAILED
}
