package com.spsync.feed;

import java.io.IOException;

/**
 * The remote rejected the supplied cursor (expired or unknown). The caller discards it and restarts
 * with a full enumeration.
 */
public class CursorExpiredException extends IOException {
    public CursorExpiredException(String message) {
        super(message);
    }
}
