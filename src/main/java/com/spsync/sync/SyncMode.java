package com.spsync.sync;

public enum SyncMode {
    /** Discard the index and cursor, enumerate the whole corpus. */
    FULL,
    /** Apply changes since the persisted cursor. */
    DELTA
}
