package com.spsync.cursor;

import java.io.IOException;

/**
 * Local persistence failed (cursor file or index file). Fatal to the running cycle; the persisted
 * cursor keeps its last good value.
 */
public class StorageException extends IOException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
