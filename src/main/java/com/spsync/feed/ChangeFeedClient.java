package com.spsync.feed;

import java.io.IOException;
import java.util.Optional;

import com.spsync.cursor.SyncCursor;

public interface ChangeFeedClient {
    /**
     * Opens a feed session at the given cursor. An empty cursor requests a full enumeration, whose
     * pages contain upserts only.
     *
     * @throws CursorExpiredException when the remote no longer accepts the cursor
     * @throws TransientRemoteException when the first page cannot be fetched
     */
    FeedSession open(Optional<SyncCursor> cursor) throws IOException;
}
