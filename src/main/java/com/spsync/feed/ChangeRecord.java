package com.spsync.feed;

import java.util.Objects;

/**
 * One entry of a change page: either a deletion marker carrying only the item id, or an upsert
 * carrying the full item metadata.
 */
public record ChangeRecord(Kind kind, String itemId, RemoteItem item) {

    public enum Kind {
        DELETE,
        UPSERT
    }

    public ChangeRecord {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(itemId, "itemId");
        if (kind == Kind.UPSERT && item == null) {
            throw new IllegalArgumentException("upsert record for " + itemId + " carries no item");
        }
    }

    public static ChangeRecord deletion(String itemId) {
        return new ChangeRecord(Kind.DELETE, itemId, null);
    }

    public static ChangeRecord upsert(RemoteItem item) {
        return new ChangeRecord(Kind.UPSERT, item.id(), item);
    }

    public boolean isDeletion() {
        return kind == Kind.DELETE;
    }
}
