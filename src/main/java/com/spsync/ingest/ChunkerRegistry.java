package com.spsync.ingest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.spsync.feed.RemoteItem;
import com.spsync.runtime.AppConfig;

/**
 * Content type to chunker dispatch, fixed at wiring time. Every produced chunk is prefixed with a
 * {@code [Document: name | Folder: path]} header so that file and folder names are searchable.
 */
public class ChunkerRegistry {
    private final Map<String, ContentChunker> chunkers = new LinkedHashMap<>();

    public ChunkerRegistry register(String contentType, ContentChunker chunker) {
        chunkers.put(normalize(contentType), chunker);
        return this;
    }

    public static ChunkerRegistry textDefaults(AppConfig.ChunkingConfig config) {
        TextChunker textChunker = new TextChunker(config.getChunkSize(), config.getChunkOverlap());
        ChunkerRegistry registry = new ChunkerRegistry();
        for (String contentType : config.getTextContentTypes()) {
            registry.register(contentType, textChunker);
        }
        return registry;
    }

    public boolean supports(String contentType) {
        return chunkers.containsKey(normalize(contentType));
    }

    public Set<String> contentTypes() {
        return Set.copyOf(chunkers.keySet());
    }

    /**
     * @throws IllegalArgumentException when no chunker is registered for the item's content type
     */
    public List<String> chunk(RemoteItem item, byte[] content) {
        ContentChunker chunker = chunkers.get(normalize(item.contentType()));
        if (chunker == null) {
            throw new IllegalArgumentException("No chunker registered for content type " + item.contentType());
        }
        String header = header(item);
        return chunker.chunk(content, item.contentType()).stream()
                .map(text -> header + text)
                .toList();
    }

    static String header(RemoteItem item) {
        StringBuilder header = new StringBuilder("[Document: ").append(item.name());
        if (item.folderPath() != null && !item.folderPath().isBlank()) {
            header.append(" | Folder: ").append(item.folderPath());
        }
        return header.append("]\n").toString();
    }

    static String normalize(String contentType) {
        if (contentType == null) {
            return "";
        }
        int parameters = contentType.indexOf(';');
        String bare = parameters >= 0 ? contentType.substring(0, parameters) : contentType;
        return bare.strip().toLowerCase(Locale.ROOT);
    }
}
