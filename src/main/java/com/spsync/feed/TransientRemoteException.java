package com.spsync.feed;

import java.io.IOException;

/**
 * Network, authentication or rate-limit failure on a remote call. Not retried inside the feed or
 * fetch layer.
 */
public class TransientRemoteException extends IOException {
    private final int statusCode;

    public TransientRemoteException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientRemoteException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return the HTTP status, or -1 when no response was received
     */
    public int statusCode() {
        return statusCode;
    }
}
