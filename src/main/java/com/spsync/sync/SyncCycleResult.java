package com.spsync.sync;

/**
 * Aggregate of one orchestrator cycle.
 *
 * @param requestedMode mode the caller asked for
 * @param mode          mode actually run; DELTA falls back to FULL when the cursor is unusable
 * @param pagesApplied  pages whose cursor was committed
 * @param failureReason why the cycle stopped early, null when it did not
 */
public record SyncCycleResult(
        SyncMode requestedMode,
        SyncMode mode,
        CycleStatus status,
        int added,
        int updated,
        int deleted,
        int unchanged,
        int skipped,
        int failed,
        int pagesApplied,
        long durationMs,
        String failureReason) {

    public static SyncCycleResult rejected(SyncMode requestedMode) {
        return new SyncCycleResult(requestedMode, requestedMode, CycleStatus.REJECTED,
                0, 0, 0, 0, 0, 0, 0, 0L, "a sync cycle is already running");
    }

    public boolean successful() {
        return status == CycleStatus.COMPLETED && failed == 0;
    }
}
