package com.spsync.graph;

import java.io.IOException;

import com.spsync.feed.ContentFetcher;

public class GraphContentFetcher implements ContentFetcher {
    private final GraphClient graphClient;

    public GraphContentFetcher(GraphClient graphClient) {
        this.graphClient = graphClient;
    }

    @Override
    public byte[] fetch(String itemId) throws IOException {
        return graphClient.getBytes("drives/" + graphClient.driveId() + "/items/" + itemId + "/content");
    }
}
