package com.spsync.ingest;

/**
 * One embedded slice of a remote item. {@code sequenceIndex} is 0-based and dense within an item.
 */
public record Chunk(String sourceItemId, int sequenceIndex, String text, ChunkMetadata metadata) {

    public String id() {
        return sourceItemId + "#" + sequenceIndex;
    }
}
