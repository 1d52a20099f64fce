package com.spsync.sync;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spsync.cursor.CursorStore;
import com.spsync.cursor.StorageException;
import com.spsync.feed.ChangePage;
import com.spsync.feed.ChangeRecord;
import com.spsync.feed.ContentFetcher;
import com.spsync.feed.ContentNotFoundException;
import com.spsync.feed.RemoteItem;
import com.spsync.ingest.Chunk;
import com.spsync.ingest.ChunkIndex;
import com.spsync.ingest.ChunkMetadata;
import com.spsync.ingest.ChunkerRegistry;
import com.spsync.ingest.EmbeddingException;
import com.spsync.ingest.IndexChangeListener;

/**
 * Applies change pages to the chunk index and owns the commit ordering: a page's cursor is saved
 * only after every record of the page was applied and the index was flushed.
 *
 * <p>Deletes run sequentially before any upsert. Upserts for distinct items run on a bounded worker
 * pool; each one deletes the item's previous chunks immediately before inserting the new ones, so
 * re-applying a page is harmless.
 */
public class Reconciler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final ChunkIndex index;
    private final CursorStore cursorStore;
    private final ContentFetcher contentFetcher;
    private final ChunkerRegistry chunkerRegistry;
    private final int maxItemRetries;
    private final long retryBackoffMs;
    private final ThreadPoolExecutor executor;
    private final List<IndexChangeListener> listeners = new CopyOnWriteArrayList<>();

    public Reconciler(ChunkIndex index,
            CursorStore cursorStore,
            ContentFetcher contentFetcher,
            ChunkerRegistry chunkerRegistry,
            int workerThreads,
            int maxItemRetries,
            long retryBackoffMs) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be > 0");
        }
        if (maxItemRetries < 0 || retryBackoffMs < 0) {
            throw new IllegalArgumentException("item retry settings must be >= 0");
        }
        this.index = index;
        this.cursorStore = cursorStore;
        this.contentFetcher = contentFetcher;
        this.chunkerRegistry = chunkerRegistry;
        this.maxItemRetries = maxItemRetries;
        this.retryBackoffMs = retryBackoffMs;

        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread thread = new Thread(r, "sync-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = new ThreadPoolExecutor(
                workerThreads,
                workerThreads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory);
    }

    public void addListener(IndexChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Applies one page. Item failures are counted, never thrown; they withhold the page's cursor.
     *
     * @param fullEnumeration whether the page comes from a full enumeration, whose delete records are ignored
     * @param cancelRequested polled before each record is started
     * @throws StorageException when flushing the index or saving the cursor fails
     */
    public PageOutcome apply(ChangePage page, boolean fullEnumeration, BooleanSupplier cancelRequested)
            throws StorageException {
        long versionBefore = index.version();
        AtomicBoolean interrupted = new AtomicBoolean(false);
        BooleanSupplier cancelled = () -> interrupted.get() || cancelRequested.getAsBoolean();

        Map<String, ChangeRecord> latest = new LinkedHashMap<>();
        for (ChangeRecord record : page.records()) {
            latest.put(record.itemId(), record);
        }

        Tally tally = new Tally();
        List<ChangeRecord> upserts = new ArrayList<>();
        for (ChangeRecord record : latest.values()) {
            if (!record.isDeletion()) {
                upserts.add(record);
                continue;
            }
            if (fullEnumeration) {
                log.debug("sync.delete.ignored id={} reason=full-enumeration", record.itemId());
                continue;
            }
            if (cancelled.getAsBoolean()) {
                tally.notStarted++;
                continue;
            }
            tally.record(record.itemId(), applyDelete(record.itemId()));
        }

        List<Future<ItemOutcome>> futures = new ArrayList<>(upserts.size());
        for (ChangeRecord record : upserts) {
            futures.add(executor.submit(() -> cancelled.getAsBoolean() ? ItemOutcome.NOT_STARTED : applyUpsert(record.item())));
        }
        for (int i = 0; i < futures.size(); i++) {
            tally.record(upserts.get(i).itemId(), await(futures.get(i), upserts.get(i).itemId(), interrupted));
        }
        if (interrupted.get()) {
            Thread.currentThread().interrupt();
        }

        boolean wasCancelled = tally.notStarted > 0 || cancelled.getAsBoolean();
        boolean committed = tally.failed() == 0 && !wasCancelled;
        try {
            if (committed) {
                commit(page);
            }
        } finally {
            long versionAfter = index.version();
            if (versionAfter != versionBefore) {
                listeners.forEach(listener -> listener.onIndexChanged(versionAfter));
            }
        }

        PageOutcome outcome = tally.toOutcome(committed, wasCancelled);
        log.info("sync.page.applied records={} added={} updated={} deleted={} unchanged={} skipped={} failed={} committed={}",
                latest.size(), outcome.added(), outcome.updated(), outcome.deleted(), outcome.unchanged(),
                outcome.skipped(), outcome.failed(), committed);
        if (!committed) {
            log.warn("sync.page.withheld cursor={} failed={} cancelled={}", page.nextCursor(), outcome.failedItemIds(), wasCancelled);
        }
        return outcome;
    }

    private void commit(ChangePage page) throws StorageException {
        try {
            index.flush();
        } catch (StorageException e) {
            throw e;
        } catch (IOException e) {
            throw new StorageException("Unable to flush chunk index", e);
        }
        cursorStore.save(page.nextCursor());
    }

    private ItemOutcome applyDelete(String itemId) {
        try {
            int removed = index.deleteBySourceId(itemId);
            log.debug("sync.item.deleted id={} chunks={}", itemId, removed);
            return removed > 0 ? ItemOutcome.DELETED : ItemOutcome.UNCHANGED;
        } catch (RuntimeException e) {
            log.warn("sync.item.failed id={} op=delete reason={}", itemId, e.getMessage(), e);
            return ItemOutcome.FAILED;
        }
    }

    ItemOutcome applyUpsert(RemoteItem item) {
        if (!chunkerRegistry.supports(item.contentType())) {
            int removed = index.deleteBySourceId(item.id());
            log.debug("sync.item.skipped id={} name={} contentType={} removedChunks={}",
                    item.id(), item.name(), item.contentType(), removed);
            return ItemOutcome.SKIPPED;
        }
        if (alreadyIndexed(item)) {
            return ItemOutcome.UNCHANGED;
        }

        int maxAttempts = maxItemRetries + 1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                byte[] content = contentFetcher.fetch(item.id());
                List<String> texts = chunkerRegistry.chunk(item, content);
                int removed = index.deleteBySourceId(item.id());
                index.insertChunks(item, texts);
                log.debug("sync.item.indexed id={} name={} chunks={} replaced={}", item.id(), item.name(), texts.size(), removed);
                return removed > 0 ? ItemOutcome.UPDATED : ItemOutcome.ADDED;
            } catch (ContentNotFoundException e) {
                log.warn("sync.item.failed id={} name={} reason={}", item.id(), item.name(), e.getMessage());
                return ItemOutcome.FAILED;
            } catch (IOException | EmbeddingException e) {
                if (attempt == maxAttempts) {
                    log.warn("sync.item.failed id={} name={} attempts={} reason={}", item.id(), item.name(), attempt, e.getMessage());
                    return ItemOutcome.FAILED;
                }
                long backoff = retryBackoffMs * attempt;
                log.warn("sync.item.retry id={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        item.id(), attempt, maxAttempts, backoff, e.getMessage());
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return ItemOutcome.FAILED;
                }
            } catch (RuntimeException e) {
                log.warn("sync.item.failed id={} name={} reason={}", item.id(), item.name(), e.toString(), e);
                return ItemOutcome.FAILED;
            }
        }
        return ItemOutcome.FAILED;
    }

    /**
     * Graph keeps the content tag on rename and move, so the stored name, folder and URL must match
     * too; they are part of every chunk's header and metadata.
     */
    private boolean alreadyIndexed(RemoteItem item) {
        if (isBlank(item.contentTag())) {
            return false;
        }
        List<Chunk> indexed = index.chunksFor(item.id());
        if (indexed.isEmpty()) {
            return false;
        }
        ChunkMetadata stored = indexed.get(0).metadata();
        return item.contentTag().equals(stored.contentTag())
                && Objects.equals(item.name(), stored.name())
                && Objects.equals(item.folderPath(), stored.folderPath())
                && Objects.equals(item.webUrl(), stored.webUrl());
    }

    private static ItemOutcome await(Future<ItemOutcome> future, String itemId, AtomicBoolean interrupted) {
        while (true) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                // let running items finish; items not yet started see the flag and skip
                interrupted.set(true);
            } catch (ExecutionException e) {
                log.warn("sync.item.failed id={} reason={}", itemId, e.getCause() == null ? e.getMessage() : e.getCause().toString());
                return ItemOutcome.FAILED;
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("sync.workers.shutdown_forced");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    enum ItemOutcome {
        ADDED,
        UPDATED,
        DELETED,
        UNCHANGED,
        SKIPPED,
        FAILED,
        NOT_STARTED
    }

    private static final class Tally {
        private int added;
        private int updated;
        private int deleted;
        private int unchanged;
        private int skipped;
        private int notStarted;
        private final List<String> failedIds = new ArrayList<>();

        void record(String itemId, ItemOutcome outcome) {
            switch (outcome) {
                case ADDED -> added++;
                case UPDATED -> updated++;
                case DELETED -> deleted++;
                case UNCHANGED -> unchanged++;
                case SKIPPED -> skipped++;
                case NOT_STARTED -> notStarted++;
                case FAILED -> failedIds.add(itemId);
            }
        }

        int failed() {
            return failedIds.size();
        }

        PageOutcome toOutcome(boolean committed, boolean cancelled) {
            return new PageOutcome(added, updated, deleted, unchanged, skipped, failed(), failedIds, committed, cancelled);
        }
    }
}
