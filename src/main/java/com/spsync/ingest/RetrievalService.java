package com.spsync.ingest;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read side of the index. Results are cached per query and dropped whenever the index reports a new
 * version, so a reader never keeps serving chunks that reconciliation has replaced.
 */
public class RetrievalService implements IndexChangeListener {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final ChunkIndex index;
    private final EmbeddingService embeddingService;
    private final Map<String, List<SearchResult>> cache = new ConcurrentHashMap<>();
    private volatile long cachedVersion;

    public RetrievalService(ChunkIndex index, EmbeddingService embeddingService) {
        this.index = index;
        this.embeddingService = embeddingService;
        this.cachedVersion = index.version();
    }

    public List<SearchResult> retrieve(String query, int topK) {
        long current = index.version();
        if (current != cachedVersion) {
            onIndexChanged(current);
        }
        return cache.computeIfAbsent(topK + "|" + query, unused -> rank(query, topK));
    }

    @Override
    public void onIndexChanged(long indexVersion) {
        if (!cache.isEmpty()) {
            log.debug("retrieval.cache.invalidated version={} entries={}", indexVersion, cache.size());
        }
        cache.clear();
        cachedVersion = indexVersion;
    }

    int cachedQueries() {
        return cache.size();
    }

    private List<SearchResult> rank(String query, int topK) {
        float[] queryEmbedding = embeddingService.embed(query);
        List<SearchResult> semantic = index.search(queryEmbedding, Math.max(topK * 3, topK));

        Set<String> queryTerms = terms(query);
        return semantic.stream()
                .map(result -> {
                    float lexical = lexicalScore(queryTerms, result.chunk().text());
                    float rerank = (result.score() * 0.7f) + (lexical * 0.3f);
                    return new SearchResult(result.chunk(), result.score(), rerank, citationSnippet(result.chunk()));
                })
                .sorted(Comparator.comparing(SearchResult::rerankScore).reversed())
                .limit(topK)
                .toList();
    }

    private static Set<String> terms(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\W+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }

    private static float lexicalScore(Set<String> queryTerms, String text) {
        if (queryTerms.isEmpty() || text.isBlank()) {
            return 0f;
        }
        Set<String> words = terms(text);
        long matches = queryTerms.stream().filter(words::contains).count();
        return (float) matches / queryTerms.size();
    }

    private static String citationSnippet(Chunk chunk) {
        String trimmed = chunk.text().strip();
        if (trimmed.length() > 240) {
            trimmed = trimmed.substring(0, 240) + "...";
        }
        String folder = chunk.metadata().folderPath();
        String source = folder == null || folder.isBlank()
                ? chunk.metadata().name()
                : folder + "/" + chunk.metadata().name();
        return "%s#%d %s".formatted(source, chunk.sequenceIndex(), trimmed.replaceAll("\\s+", " "));
    }
}
