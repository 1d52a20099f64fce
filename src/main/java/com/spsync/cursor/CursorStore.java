package com.spsync.cursor;

import java.util.Optional;

public interface CursorStore {
    /**
     * @return the saved cursor, or empty when none is saved or the saved one is unreadable
     */
    Optional<SyncCursor> load();

    void save(SyncCursor cursor) throws StorageException;

    void clear() throws StorageException;
}
