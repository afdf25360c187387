package com.ascend.modsync.sync.model;

public enum FetchPriority {
    ON_DEMAND,
    BACKGROUND
}
