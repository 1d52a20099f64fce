package com.spsync.feed;

import java.io.IOException;

@FunctionalInterface
public interface ContentFetcher {
    /**
     * @throws ContentNotFoundException when the item no longer exists remotely
     * @throws TransientRemoteException on network, auth or throttling failures
     */
    byte[] fetch(String itemId) throws IOException;
}
