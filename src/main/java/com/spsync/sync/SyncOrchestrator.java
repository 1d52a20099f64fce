package com.spsync.sync;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spsync.cursor.CursorStore;
import com.spsync.cursor.StorageException;
import com.spsync.cursor.SyncCursor;
import com.spsync.feed.ChangeFeedClient;
import com.spsync.feed.ChangePage;
import com.spsync.feed.CursorExpiredException;
import com.spsync.feed.FeedSession;
import com.spsync.ingest.ChunkIndex;

/**
 * Runs sync cycles, one at a time per process. A request that arrives while a cycle runs is
 * rejected, not queued.
 *
 * <p>A DELTA cycle resumes from the persisted cursor and falls back to FULL when there is no cursor,
 * when the remote rejects it, or when the index was embedded by another model. A FULL cycle drops
 * the cursor and the index and enumerates the whole corpus. Either way the feed is drained page by
 * page until it is exhausted or a page fails to commit.
 */
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final ChangeFeedClient feedClient;
    private final CursorStore cursorStore;
    private final ChunkIndex index;
    private final Reconciler reconciler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    // running and cancelRequested only change together under this lock
    private final Object cycleGuard = new Object();

    public SyncOrchestrator(ChangeFeedClient feedClient, CursorStore cursorStore, ChunkIndex index, Reconciler reconciler) {
        this.feedClient = feedClient;
        this.cursorStore = cursorStore;
        this.index = index;
        this.reconciler = reconciler;
    }

    /**
     * @throws StorageException when the cursor or the index cannot be persisted; the cycle ends and
     *                          the persisted cursor keeps its last good value
     */
    public SyncCycleResult runCycle(SyncMode requestedMode) throws StorageException {
        synchronized (cycleGuard) {
            if (running.get()) {
                log.warn("sync.cycle.rejected mode={} reason=cycle-running", requestedMode);
                return SyncCycleResult.rejected(requestedMode);
            }
            cancelRequested.set(false);
            running.set(true);
        }
        CycleTally tally = new CycleTally(requestedMode);
        try {
            log.info("sync.cycle.started mode={}", requestedMode);
            FeedSession session;
            try {
                session = openSession(tally);
            } catch (StorageException e) {
                throw e;
            } catch (IOException e) {
                log.error("sync.cycle.failed mode={} stage=open reason={}", tally.mode, e.getMessage());
                return tally.finish(CycleStatus.FAILED, "feed open failed: " + e.getMessage());
            }
            return drain(session, tally);
        } finally {
            synchronized (cycleGuard) {
                running.set(false);
                cancelRequested.set(false);
            }
        }
    }

    /**
     * Requests cooperative cancellation of the running cycle. Items already in flight complete; the
     * current page is not committed.
     */
    public void cancel() {
        synchronized (cycleGuard) {
            if (running.get()) {
                log.info("sync.cycle.cancel_requested");
                cancelRequested.set(true);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private FeedSession openSession(CycleTally tally) throws IOException {
        if (tally.requestedMode == SyncMode.DELTA) {
            if (index.requiresReembedding()) {
                log.info("sync.fallback from=DELTA to=FULL reason=embedding-version-changed");
            } else {
                Optional<SyncCursor> cursor = cursorStore.load();
                if (cursor.isEmpty()) {
                    log.info("sync.fallback from=DELTA to=FULL reason=no-cursor");
                } else {
                    try {
                        return feedClient.open(cursor);
                    } catch (CursorExpiredException e) {
                        log.warn("sync.fallback from=DELTA to=FULL reason=cursor-expired cursor={}", cursor.get());
                    }
                }
            }
        }
        tally.mode = SyncMode.FULL;
        // the cursor goes first so no surviving cursor ever describes a cleared index
        cursorStore.clear();
        index.clear();
        return feedClient.open(Optional.empty());
    }

    private SyncCycleResult drain(FeedSession session, CycleTally tally) throws StorageException {
        try (session) {
            while (session.hasNextPage()) {
                if (cancelRequested.get()) {
                    return tally.finish(CycleStatus.CANCELLED, "cancelled");
                }
                ChangePage page = session.nextPage();
                PageOutcome outcome = reconciler.apply(page, session.fullEnumeration(), cancelRequested::get);
                tally.add(outcome);
                if (outcome.cancelled()) {
                    return tally.finish(CycleStatus.CANCELLED, "cancelled");
                }
                if (!outcome.committed()) {
                    return tally.finish(CycleStatus.FAILED, outcome.failed() + " item(s) failed: " + outcome.failedItemIds());
                }
            }
            return tally.finish(CycleStatus.COMPLETED, null);
        } catch (StorageException e) {
            log.error("sync.cycle.aborted mode={} reason={}", tally.mode, e.getMessage());
            throw e;
        } catch (IOException e) {
            log.error("sync.cycle.failed mode={} stage=page reason={}", tally.mode, e.getMessage());
            return tally.finish(CycleStatus.FAILED, "feed page failed: " + e.getMessage());
        }
    }

    private static final class CycleTally {
        private final SyncMode requestedMode;
        private final long startedNanos = System.nanoTime();
        private SyncMode mode;
        private int added;
        private int updated;
        private int deleted;
        private int unchanged;
        private int skipped;
        private int failed;
        private int pagesApplied;

        CycleTally(SyncMode requestedMode) {
            this.requestedMode = requestedMode;
            this.mode = requestedMode;
        }

        void add(PageOutcome outcome) {
            added += outcome.added();
            updated += outcome.updated();
            deleted += outcome.deleted();
            unchanged += outcome.unchanged();
            skipped += outcome.skipped();
            failed += outcome.failed();
            if (outcome.committed()) {
                pagesApplied++;
            }
        }

        SyncCycleResult finish(CycleStatus status, String failureReason) {
            long durationMs = (System.nanoTime() - startedNanos) / 1_000_000L;
            SyncCycleResult result = new SyncCycleResult(requestedMode, mode, status,
                    added, updated, deleted, unchanged, skipped, failed, pagesApplied, durationMs, failureReason);
            log.info("sync.cycle.finished mode={} status={} added={} updated={} deleted={} unchanged={} skipped={} failed={} pages={} durationMs={}",
                    mode, status, added, updated, deleted, unchanged, skipped, failed, pagesApplied, durationMs);
            return result;
        }
    }
}
