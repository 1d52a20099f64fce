package com.spsync.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.spsync.cursor.StorageException;
import com.spsync.feed.RemoteItem;
import com.spsync.runtime.AtomicFileWriter;

/**
 * In-memory chunk index persisted as one JSON document. Chunks are grouped per source item so an
 * item's chunk set is swapped as a unit under the write lock; embedding happens before the lock is
 * taken.
 */
public class LocalJsonChunkIndex implements ChunkIndex {
    private static final Logger log = LoggerFactory.getLogger(LocalJsonChunkIndex.class);
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private final Map<String, List<IndexedChunk>> chunksBySource = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong version = new AtomicLong();
    private final AtomicBoolean dirty = new AtomicBoolean();
    private final EmbeddingService embeddingService;
    private final Path path;

    public LocalJsonChunkIndex(EmbeddingService embeddingService, Path path) {
        this.embeddingService = embeddingService;
        this.path = path;
    }

    public static LocalJsonChunkIndex open(Path path, EmbeddingService embeddingService) throws IOException {
        LocalJsonChunkIndex index = new LocalJsonChunkIndex(embeddingService, path);
        if (path == null || !Files.exists(path)) {
            return index;
        }
        try {
            IndexSnapshot snapshot = MAPPER.readValue(path.toFile(), IndexSnapshot.class);
            List<IndexedChunk> loaded = snapshot.chunks() == null ? List.of() : snapshot.chunks();
            for (IndexedChunk entry : loaded) {
                index.chunksBySource
                        .computeIfAbsent(entry.chunk().sourceItemId(), unused -> new ArrayList<>())
                        .add(entry);
            }
            index.chunksBySource.values().forEach(list -> list.sort(BY_SEQUENCE));
            log.info("index.loaded path={} items={} chunks={}", path, index.chunksBySource.size(), loaded.size());
            return index;
        } catch (IOException e) {
            throw new StorageException("Unable to read chunk index " + path, e);
        }
    }

    @Override
    public int deleteBySourceId(String sourceItemId) {
        lock.writeLock().lock();
        try {
            List<IndexedChunk> removed = chunksBySource.remove(sourceItemId);
            if (removed == null || removed.isEmpty()) {
                return 0;
            }
            markChanged();
            return removed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void insertChunks(RemoteItem item, List<String> texts) {
        if (texts.isEmpty()) {
            return;
        }
        ChunkMetadata metadata = new ChunkMetadata(
                item.name(),
                item.folderPath(),
                item.contentTag(),
                item.webUrl(),
                item.lastModified());
        String embeddingVersion = embeddingService.version();
        List<IndexedChunk> prepared = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            Chunk chunk = new Chunk(item.id(), i, texts.get(i), metadata);
            prepared.add(new IndexedChunk(chunk, embeddingService.embed(chunk.text()), embeddingVersion));
        }

        lock.writeLock().lock();
        try {
            chunksBySource.put(item.id(), prepared);
            markChanged();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return chunksBySource.values().stream().mapToInt(List::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            chunksBySource.clear();
            markChanged();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Chunk> chunksFor(String sourceItemId) {
        lock.readLock().lock();
        try {
            return chunksBySource.getOrDefault(sourceItemId, List.of()).stream()
                    .map(IndexedChunk::chunk)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<String> contentTag(String sourceItemId) {
        lock.readLock().lock();
        try {
            List<IndexedChunk> chunks = chunksBySource.get(sourceItemId);
            if (chunks == null || chunks.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(chunks.get(0).chunk().metadata().contentTag());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SearchResult> search(float[] queryEmbedding, int topK) {
        lock.readLock().lock();
        try {
            return chunksBySource.values().stream()
                    .flatMap(List::stream)
                    .map(indexed -> {
                        float cosine = cosine(queryEmbedding, indexed.embedding());
                        return new SearchResult(indexed.chunk(), cosine, cosine, "");
                    })
                    .sorted(Comparator.comparing(SearchResult::score).reversed())
                    .limit(topK)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long version() {
        return version.get();
    }

    @Override
    public synchronized void flush() throws IOException {
        if (path == null || !dirty.getAndSet(false)) {
            return;
        }
        IndexSnapshot snapshot;
        lock.readLock().lock();
        try {
            List<IndexedChunk> all = new ArrayList<>();
            chunksBySource.values().forEach(all::addAll);
            snapshot = new IndexSnapshot(embeddingService.version(), all);
        } finally {
            lock.readLock().unlock();
        }
        try {
            AtomicFileWriter.write(path, MAPPER.writeValueAsBytes(snapshot));
            log.debug("index.flushed path={} chunks={}", path, snapshot.chunks().size());
        } catch (IOException e) {
            dirty.set(true);
            throw new StorageException("Unable to persist chunk index to " + path, e);
        }
    }

    @Override
    public boolean requiresReembedding() {
        String current = embeddingService.version();
        lock.readLock().lock();
        try {
            return chunksBySource.values().stream()
                    .flatMap(List::stream)
                    .anyMatch(indexed -> !current.equals(indexed.embeddingVersion()));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void markChanged() {
        version.incrementAndGet();
        dirty.set(true);
    }

    private static float cosine(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        float dot = 0f;
        float aNorm = 0f;
        float bNorm = 0f;
        for (int i = 0; i < len; i++) {
            dot += a[i] * b[i];
            aNorm += a[i] * a[i];
            bNorm += b[i] * b[i];
        }
        if (aNorm == 0f || bNorm == 0f) {
            return 0f;
        }
        return (float) (dot / Math.sqrt(aNorm * bNorm));
    }

    private static final Comparator<IndexedChunk> BY_SEQUENCE =
            Comparator.comparingInt(indexed -> indexed.chunk().sequenceIndex());

    public record IndexedChunk(Chunk chunk, float[] embedding, String embeddingVersion) {
    }

    public record IndexSnapshot(
            @JsonProperty("embeddingVersion") String embeddingVersion,
            @JsonProperty("chunks") List<IndexedChunk> chunks) {
    }
}
