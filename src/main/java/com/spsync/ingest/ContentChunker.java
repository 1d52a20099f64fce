package com.spsync.ingest;

import java.util.List;

/**
 * Turns the raw bytes of one document into ordered chunk texts. Must be deterministic: the same
 * bytes always yield the same texts.
 */
public interface ContentChunker {
    List<String> chunk(byte[] content, String contentType);
}
