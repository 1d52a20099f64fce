package com.spsync.ingest;

public record SearchResult(Chunk chunk, float score, float rerankScore, String citationSnippet) {
}
