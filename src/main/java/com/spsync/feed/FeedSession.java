package com.spsync.feed;

import java.io.Closeable;
import java.io.IOException;

/**
 * Lazy, finite sequence of change pages produced by one {@link ChangeFeedClient#open} call.
 * Consuming every page exhausts the session.
 */
public interface FeedSession extends Closeable {
    boolean hasNextPage();

    /**
     * Fetches the next page.
     *
     * @throws java.util.NoSuchElementException when the session is exhausted
     * @throws TransientRemoteException when the remote call fails
     */
    ChangePage nextPage() throws IOException;

    /**
     * Whether this session enumerates the whole corpus instead of a delta.
     */
    boolean fullEnumeration();

    @Override
    default void close() {
    }
}
