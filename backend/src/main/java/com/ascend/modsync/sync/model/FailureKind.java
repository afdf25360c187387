package com.ascend.modsync.sync.model;

public enum FailureKind {
    TRANSIENT,
    PERMANENT
}
