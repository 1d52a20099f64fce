package com.spsync.ingest;

import java.time.Instant;

public record ChunkMetadata(
        String name,
        String folderPath,
        String contentTag,
        String webUrl,
        Instant lastModified) {
}
