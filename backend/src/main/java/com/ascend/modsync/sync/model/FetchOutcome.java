package com.ascend.modsync.sync.model;

public enum FetchOutcome {
    SUBMITTED,
    ALREADY_IN_FLIGHT,
    RATE_LIMITED,
    REJECTED
}
