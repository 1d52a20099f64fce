package com.spsync.ingest;

public interface EmbeddingService {
    /**
     * @throws EmbeddingException when the provider cannot produce a vector
     */
    float[] embed(String text);

    int dimension();

    /**
     * Identifies the model that produced the vectors. An index built under another version has to
     * be rebuilt from scratch.
     */
    String version();
}
