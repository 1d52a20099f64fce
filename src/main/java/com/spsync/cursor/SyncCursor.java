package com.spsync.cursor;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Opaque position in the remote change history. Everything before it has been durably applied to
 * the index. The token is stored and forwarded as-is; it is never parsed or compared structurally.
 */
public record SyncCursor(
        @JsonProperty("token") String token,
        @JsonProperty("updated_at") Instant createdAt) {

    public SyncCursor {
        Objects.requireNonNull(token, "token");
        if (token.isBlank()) {
            throw new IllegalArgumentException("cursor token must not be blank");
        }
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static SyncCursor of(String token) {
        return new SyncCursor(token, Instant.now());
    }

    @Override
    public String toString() {
        // delta links carry long query strings; keep log lines readable
        String shortened = token.length() > 48 ? token.substring(0, 24) + "..." + token.substring(token.length() - 16) : token;
        return "SyncCursor{" + shortened + " @ " + createdAt + "}";
    }
}
