package com.spsync.sync;

import static com.spsync.feed.ScriptedChangeFeed.page;
import static com.spsync.feed.ScriptedChangeFeed.textItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.spsync.cursor.CursorStore;
import com.spsync.cursor.JsonFileCursorStore;
import com.spsync.cursor.StorageException;
import com.spsync.cursor.SyncCursor;
import com.spsync.feed.ChangeFeedClient;
import com.spsync.feed.ChangeRecord;
import com.spsync.feed.MapContentFetcher;
import com.spsync.feed.ScriptedChangeFeed;
import com.spsync.feed.TransientRemoteException;
import com.spsync.ingest.Chunk;
import com.spsync.ingest.ChunkerRegistry;
import com.spsync.ingest.LocalJsonChunkIndex;
import com.spsync.ingest.LocalModelEmbeddingService;

class SyncOrchestratorTest {

    @TempDir
    Path tempDir;

    private LocalJsonChunkIndex index;
    private JsonFileCursorStore cursorStore;
    private MapContentFetcher fetcher;
    private ScriptedChangeFeed feed;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        index = new LocalJsonChunkIndex(new LocalModelEmbeddingService(32), tempDir.resolve("index.json"));
        cursorStore = new JsonFileCursorStore(tempDir.resolve("cursor.json"));
        fetcher = new MapContentFetcher();
        feed = new ScriptedChangeFeed();
    }

    @AfterEach
    void tearDown() {
        if (reconciler != null) {
            reconciler.close();
        }
    }

    @Test
    void shouldFallBackToFullWhenNoCursorIsStored() throws Exception {
        fetcher.put("X", "x-0|x-1").put("Y", "y-0");
        feed.thenSession(page("delta-1", false,
                ChangeRecord.upsert(textItem("X", "x1")),
                ChangeRecord.upsert(textItem("Y", "y1"))));

        SyncCycleResult result = orchestrator(cursorStore).runCycle(SyncMode.DELTA);

        assertEquals(CycleStatus.COMPLETED, result.status());
        assertEquals(SyncMode.DELTA, result.requestedMode());
        assertEquals(SyncMode.FULL, result.mode());
        assertEquals(2, result.added());
        assertEquals(3, index.count());
        assertEquals(List.of(Optional.<SyncCursor>empty()), feed.openedWith());
        assertEquals("delta-1", cursorStore.load().orElseThrow().token());
    }

    @Test
    void shouldResumeDeltaFromStoredCursor() throws Exception {
        cursorStore.save(SyncCursor.of("delta-0"));
        index.insertChunks(textItem("A", "a1"), List.of("a-0", "a-1"));
        index.insertChunks(textItem("B", "b1"), List.of("b-0", "b-1", "b-2"));
        fetcher.put("C", "c-0");
        feed.thenSession(page("delta-1", false, ChangeRecord.deletion("A"), ChangeRecord.upsert(textItem("C", "c1"))));

        SyncCycleResult result = orchestrator(cursorStore).runCycle(SyncMode.DELTA);

        assertEquals(SyncMode.DELTA, result.mode());
        assertEquals("delta-0", feed.openedWith().get(0).orElseThrow().token());
        assertEquals(4, index.count());
        assertTrue(index.chunksFor("A").isEmpty());
        assertEquals(1, index.chunksFor("C").size());
        assertEquals("delta-1", cursorStore.load().orElseThrow().token());
    }

    @Test
    void shouldReachSameStateWhenPageIsAppliedTwice() throws Exception {
        cursorStore.save(SyncCursor.of("delta-0"));
        index.insertChunks(textItem("X", "x1"), List.of("x-old"));
        fetcher.put("X", "x-0|x-1");
        feed.thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x2")), ChangeRecord.deletion("Z")))
                .thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x2")), ChangeRecord.deletion("Z")));
        SyncOrchestrator orchestrator = orchestrator(cursorStore);

        orchestrator.runCycle(SyncMode.DELTA);
        List<String> afterFirst = texts("X");
        int countAfterFirst = index.count();
        cursorStore.save(SyncCursor.of("delta-0"));
        SyncCycleResult second = orchestrator.runCycle(SyncMode.DELTA);

        assertEquals(CycleStatus.COMPLETED, second.status());
        assertEquals(afterFirst, texts("X"));
        assertEquals(countAfterFirst, index.count());
        assertEquals(2, texts("X").size());
    }

    @Test
    void shouldRebuildIndexOnFullResync() throws Exception {
        cursorStore.save(SyncCursor.of("delta-0"));
        index.insertChunks(textItem("STALE", "s1"), List.of("s-0", "s-1"));
        fetcher.put("X", "x-0").put("Y", "y-0|y-1");
        feed.thenSession(
                page("page-1", true, ChangeRecord.upsert(textItem("X", "x1"))),
                page("delta-1", false, ChangeRecord.upsert(textItem("Y", "y1"))));

        SyncCycleResult result = orchestrator(cursorStore).runCycle(SyncMode.FULL);

        assertEquals(SyncMode.FULL, result.mode());
        assertEquals(2, result.pagesApplied());
        assertEquals(3, index.count());
        assertTrue(index.chunksFor("STALE").isEmpty());
        assertEquals(List.of(Optional.<SyncCursor>empty()), feed.openedWith());
        assertEquals("delta-1", cursorStore.load().orElseThrow().token());
    }

    @Test
    void shouldKeepCursorOfLastCommittedPageWhenLaterPageFails() throws Exception {
        cursorStore.save(SyncCursor.of("delta-0"));
        fetcher.put("X", "x-0").put("Z", "z-0").fail("Y", new TransientRemoteException("throttled", 503));
        feed.thenSession(
                page("page-1", true, ChangeRecord.upsert(textItem("X", "x1"))),
                page("page-2", true, ChangeRecord.upsert(textItem("Y", "y1"))),
                page("delta-1", false, ChangeRecord.upsert(textItem("Z", "z1"))));

        SyncCycleResult result = orchestrator(cursorStore).runCycle(SyncMode.DELTA);

        assertEquals(CycleStatus.FAILED, result.status());
        assertEquals(1, result.failed());
        assertEquals(1, result.pagesApplied());
        assertFalse(result.successful());
        assertEquals("page-1", cursorStore.load().orElseThrow().token());
        assertTrue(index.chunksFor("Z").isEmpty());
    }

    @Test
    void shouldFallBackToFullWhenCursorExpired() throws Exception {
        cursorStore.save(SyncCursor.of("delta-old"));
        index.insertChunks(textItem("STALE", "s1"), List.of("s-0"));
        feed.rejectCursors(true);
        fetcher.put("X", "x-0");
        feed.thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x1"))));

        SyncCycleResult result = orchestrator(cursorStore).runCycle(SyncMode.DELTA);

        assertEquals(CycleStatus.COMPLETED, result.status());
        assertEquals(SyncMode.FULL, result.mode());
        assertEquals(2, feed.openedWith().size());
        assertEquals("delta-old", feed.openedWith().get(0).orElseThrow().token());
        assertTrue(feed.openedWith().get(1).isEmpty());
        assertEquals(1, index.count());
        assertEquals("delta-1", cursorStore.load().orElseThrow().token());
    }

    @Test
    void shouldFallBackToFullWhenEmbeddingModelChanged() throws Exception {
        Path indexPath = tempDir.resolve("reembed-index.json");
        LocalJsonChunkIndex previous = LocalJsonChunkIndex.open(indexPath, new LocalModelEmbeddingService(16));
        previous.insertChunks(textItem("X", "x1"), List.of("x-0"));
        previous.flush();
        index = LocalJsonChunkIndex.open(indexPath, new LocalModelEmbeddingService(32));
        cursorStore.save(SyncCursor.of("delta-0"));
        fetcher.put("X", "x-0");
        feed.thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x1"))));

        SyncCycleResult result = orchestrator(cursorStore).runCycle(SyncMode.DELTA);

        assertEquals(SyncMode.FULL, result.mode());
        assertEquals(1, result.added());
        assertFalse(index.requiresReembedding());
    }

    @Test
    void shouldRejectCycleWhileAnotherIsRunning() throws Exception {
        fetcher.put("X", "x-0").holdFetches();
        feed.thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x1"))));
        SyncOrchestrator orchestrator = orchestrator(cursorStore);

        CompletableFuture<SyncCycleResult> first = CompletableFuture.supplyAsync(() -> {
            try {
                return orchestrator.runCycle(SyncMode.FULL);
            } catch (StorageException e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(fetcher.awaitFirstFetch(5, TimeUnit.SECONDS));
        assertTrue(orchestrator.isRunning());

        SyncCycleResult rejected = orchestrator.runCycle(SyncMode.DELTA);
        fetcher.release();

        assertEquals(CycleStatus.REJECTED, rejected.status());
        assertEquals(CycleStatus.COMPLETED, first.get(5, TimeUnit.SECONDS).status());
        assertEquals(1, feed.openedWith().size());
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void shouldNotCommitPageWhenCancelled() throws Exception {
        cursorStore.save(SyncCursor.of("delta-0"));
        fetcher.put("X", "x-0").holdFetches();
        feed.thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x1"))));
        SyncOrchestrator orchestrator = orchestrator(cursorStore);

        CompletableFuture<SyncCycleResult> running = CompletableFuture.supplyAsync(() -> {
            try {
                return orchestrator.runCycle(SyncMode.DELTA);
            } catch (StorageException e) {
                throw new IllegalStateException(e);
            }
        });
        assertTrue(fetcher.awaitFirstFetch(5, TimeUnit.SECONDS));
        orchestrator.cancel();
        fetcher.release();

        assertEquals(CycleStatus.CANCELLED, running.get(5, TimeUnit.SECONDS).status());
        assertEquals("delta-0", cursorStore.load().orElseThrow().token());
    }

    @Test
    void shouldHonourCancelIssuedRightAfterCycleStarted() throws Exception {
        cursorStore.save(SyncCursor.of("delta-0"));
        fetcher.put("X", "x-0");
        feed.thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x1"))));
        AtomicReference<SyncOrchestrator> self = new AtomicReference<>();
        ChangeFeedClient cancellingFeed = cursor -> {
            self.get().cancel();
            return feed.open(cursor);
        };
        reconciler = new Reconciler(index, cursorStore, fetcher, textRegistry(), 4, 0, 0L);
        SyncOrchestrator orchestrator = new SyncOrchestrator(cancellingFeed, cursorStore, index, reconciler);
        self.set(orchestrator);

        SyncCycleResult result = orchestrator.runCycle(SyncMode.DELTA);

        assertEquals(CycleStatus.CANCELLED, result.status());
        assertEquals(0, fetcher.fetchCount());
        assertEquals("delta-0", cursorStore.load().orElseThrow().token());
    }

    @Test
    void shouldIgnoreCancelWhileIdle() throws Exception {
        fetcher.put("X", "x-0");
        feed.thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x1"))));
        SyncOrchestrator orchestrator = orchestrator(cursorStore);

        orchestrator.cancel();
        SyncCycleResult result = orchestrator.runCycle(SyncMode.DELTA);

        assertEquals(CycleStatus.COMPLETED, result.status());
        assertEquals("delta-1", cursorStore.load().orElseThrow().token());
    }

    @Test
    void shouldPropagateCursorStorageFailureAndReleaseLock() throws Exception {
        CursorStore failingStore = new CursorStore() {
            @Override
            public Optional<SyncCursor> load() {
                return Optional.of(SyncCursor.of("delta-0"));
            }

            @Override
            public void save(SyncCursor cursor) throws StorageException {
                throw new StorageException("read-only volume", new IOException("EROFS"));
            }

            @Override
            public void clear() {
            }
        };
        fetcher.put("X", "x-0");
        feed.thenSession(page("delta-1", false, ChangeRecord.upsert(textItem("X", "x1"))));
        SyncOrchestrator orchestrator = orchestrator(failingStore);

        assertThrows(StorageException.class, () -> orchestrator.runCycle(SyncMode.DELTA));
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void shouldEndCycleAsFailedWhenFeedPageCannotBeFetched() throws Exception {
        cursorStore.save(SyncCursor.of("delta-0"));
        fetcher.put("X", "x-0");
        feed.thenSessionFailingAfter(new TransientRemoteException("gateway timeout", 504),
                page("page-1", true, ChangeRecord.upsert(textItem("X", "x1"))));

        SyncCycleResult result = orchestrator(cursorStore).runCycle(SyncMode.DELTA);

        assertEquals(CycleStatus.FAILED, result.status());
        assertTrue(result.failureReason().contains("gateway timeout"));
        assertEquals("page-1", cursorStore.load().orElseThrow().token());
    }

    @Test
    void shouldEndCycleAsFailedWhenFeedCannotBeOpened() throws Exception {
        cursorStore.save(SyncCursor.of("delta-0"));
        feed.failNextOpen(new TransientRemoteException("unauthorized", 401));

        SyncCycleResult result = orchestrator(cursorStore).runCycle(SyncMode.DELTA);

        assertEquals(CycleStatus.FAILED, result.status());
        assertEquals("delta-0", cursorStore.load().orElseThrow().token());
    }

    private SyncOrchestrator orchestrator(CursorStore store) {
        reconciler = new Reconciler(index, store, fetcher, textRegistry(), 4, 0, 0L);
        return new SyncOrchestrator(feed, store, index, reconciler);
    }

    private static ChunkerRegistry textRegistry() {
        return new ChunkerRegistry()
                .register("text/plain", (content, type) -> List.of(new String(content, StandardCharsets.UTF_8).split("\\|")));
    }

    private List<String> texts(String itemId) {
        return index.chunksFor(itemId).stream().map(Chunk::text).toList();
    }
}
