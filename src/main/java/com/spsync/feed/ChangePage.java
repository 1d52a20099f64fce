package com.spsync.feed;

import java.util.List;

import com.spsync.cursor.SyncCursor;

/**
 * @param records     changes in feed order
 * @param nextCursor  position to persist once every record of this page is applied
 * @param hasMore     whether the session holds further pages
 */
public record ChangePage(List<ChangeRecord> records, SyncCursor nextCursor, boolean hasMore) {

    public ChangePage {
        records = List.copyOf(records);
    }
}
