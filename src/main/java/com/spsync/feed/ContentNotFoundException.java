package com.spsync.feed;

import java.io.IOException;

public class ContentNotFoundException extends IOException {
    public ContentNotFoundException(String message) {
        super(message);
    }
}
