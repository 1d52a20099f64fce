package com.spsync.graph;

import java.io.IOException;

@FunctionalInterface
public interface AccessTokenProvider {
    /**
     * @return a bearer token valid for at least the next remote call
     */
    String accessToken() throws IOException;
}
