package com.spsync.ingest;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.spsync.feed.RemoteItem;

/**
 * Chunk storage as seen by reconciliation. Implementations tolerate concurrent writers on distinct
 * item ids and readers running alongside writers.
 */
public interface ChunkIndex {
    /**
     * Removes every chunk owned by the item. Unknown ids are not an error.
     *
     * @return number of chunks removed
     */
    int deleteBySourceId(String sourceItemId);

    /**
     * Embeds and stores the texts as the item's chunks, in order. Either all texts are stored or
     * none are.
     *
     * @throws EmbeddingException when a text cannot be embedded
     */
    void insertChunks(RemoteItem item, List<String> texts);

    int count();

    void clear();

    List<Chunk> chunksFor(String sourceItemId);

    /**
     * @return the content tag the item's chunks were built from, empty when the item has none
     */
    Optional<String> contentTag(String sourceItemId);

    List<SearchResult> search(float[] queryEmbedding, int topK);

    /**
     * Monotonic counter bumped by every mutation that changed stored chunks.
     */
    long version();

    /**
     * Durably persists pending mutations.
     */
    void flush() throws IOException;

    /**
     * Whether stored chunks were embedded by a model other than the current one.
     */
    boolean requiresReembedding();
}
