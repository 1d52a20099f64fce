package com.spsync.sync;

import java.util.List;

/**
 * Result of applying one change page.
 *
 * @param committed whether the index was flushed and the page cursor saved
 * @param cancelled whether cancellation left records of the page unapplied
 */
public record PageOutcome(
        int added,
        int updated,
        int deleted,
        int unchanged,
        int skipped,
        int failed,
        List<String> failedItemIds,
        boolean committed,
        boolean cancelled) {

    public PageOutcome {
        failedItemIds = List.copyOf(failedItemIds);
    }
}
