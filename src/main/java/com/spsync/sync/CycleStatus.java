package com.spsync.sync;

public enum CycleStatus {
    COMPLETED,
    FAILED,
    REJECTED,
    CANCELLED
}
