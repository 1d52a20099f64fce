package com.spsync.feed;

import java.time.Instant;

/**
 * One source document as reported by the change feed. {@code contentTag} changes iff the content
 * changed; metadata-only edits (rename, move) keep it.
 */
public record RemoteItem(
        String id,
        String name,
        String folderPath,
        String contentTag,
        String contentType,
        long size,
        Instant lastModified,
        String webUrl) {

    public static RemoteItem of(String id, String name, String contentTag, String contentType) {
        return new RemoteItem(id, name, "", contentTag, contentType, 0L, null, "");
    }
}
