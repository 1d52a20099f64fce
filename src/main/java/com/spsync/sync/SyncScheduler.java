package com.spsync.sync;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spsync.cursor.StorageException;
import com.spsync.runtime.AppConfig;

/**
 * Triggers DELTA cycles at a fixed rate. A trigger that fires while a cycle is still running is
 * skipped and logged. Cycle failures are logged and recorded; the schedule keeps going.
 */
public class SyncScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final SyncOrchestrator orchestrator;
    private final SyncStatusStore statusStore;
    private final AppConfig.SchedulerConfig config;
    private final ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(
            r -> daemon(r, "sync-scheduler"));
    private final ExecutorService cycleRunner = Executors.newSingleThreadExecutor(
            r -> daemon(r, "sync-cycle"));
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong skippedTriggers = new AtomicLong();
    private final CountDownLatch finished = new CountDownLatch(1);

    public SyncScheduler(SyncOrchestrator orchestrator, SyncStatusStore statusStore, AppConfig.SchedulerConfig config) {
        if (config.getIntervalMs() <= 0) {
            throw new IllegalArgumentException("scheduler.intervalMs must be > 0");
        }
        if (config.getInitialDelayMs() < 0 || config.getMaxCycles() < 0) {
            throw new IllegalArgumentException("scheduler.initialDelayMs and scheduler.maxCycles must be >= 0");
        }
        this.orchestrator = orchestrator;
        this.statusStore = statusStore;
        this.config = config;
    }

    public void start() {
        log.info("sync.schedule.started intervalMs={} initialDelayMs={} maxCycles={}",
                config.getIntervalMs(), config.getInitialDelayMs(), config.getMaxCycles());
        ticker.scheduleAtFixedRate(this::trigger, config.getInitialDelayMs(), config.getIntervalMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Blocks until {@code maxCycles} cycles completed or {@link #stop()} was called.
     */
    public void awaitCompletion() throws InterruptedException {
        finished.await();
    }

    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.info("sync.schedule.stopping completed={} skipped={}", completedCycles.get(), skippedTriggers.get());
            ticker.shutdownNow();
            orchestrator.cancel();
        }
        finished.countDown();
    }

    public long completedCycles() {
        return completedCycles.get();
    }

    public long skippedTriggers() {
        return skippedTriggers.get();
    }

    void trigger() {
        if (stopped.get()) {
            return;
        }
        if (orchestrator.isRunning() || !cycleInFlight.compareAndSet(false, true)) {
            skippedTriggers.incrementAndGet();
            log.info("sync.schedule.skipped reason=cycle-running skipped={}", skippedTriggers.get());
            recordSkip();
            return;
        }
        cycleRunner.execute(this::runCycle);
    }

    private void runCycle() {
        try {
            if (stopped.get() || !executeCycle()) {
                return;
            }
            long done = completedCycles.incrementAndGet();
            if (config.getMaxCycles() > 0 && done >= config.getMaxCycles()) {
                log.info("sync.schedule.stop reason=max-cycles cycles={}", done);
                stopped.set(true);
                ticker.shutdown();
                finished.countDown();
            }
        } finally {
            cycleInFlight.set(false);
        }
    }

    /**
     * @return whether a cycle actually ran, false when the orchestrator rejected it
     */
    private boolean executeCycle() {
        try {
            SyncCycleResult result = orchestrator.runCycle(SyncMode.DELTA);
            if (result.status() == CycleStatus.REJECTED) {
                skippedTriggers.incrementAndGet();
                recordSkip();
                return false;
            }
            if (!result.successful()) {
                log.warn("sync.schedule.cycle_unsuccessful status={} reason={}", result.status(), result.failureReason());
            }
            statusStore.recordCycle(result);
        } catch (Exception e) {
            log.error("sync.schedule.cycle_failed reason={}", e.getMessage(), e);
            recordError(e);
        }
        return true;
    }

    private void recordSkip() {
        try {
            statusStore.recordSkippedTrigger();
        } catch (StorageException e) {
            log.warn("sync.schedule.status_unwritable reason={}", e.getMessage());
        }
    }

    private void recordError(Exception error) {
        try {
            statusStore.recordError(error);
        } catch (StorageException e) {
            log.warn("sync.schedule.status_unwritable reason={}", e.getMessage());
        }
    }

    @Override
    public void close() {
        stop();
        cycleRunner.shutdown();
        try {
            if (!cycleRunner.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("sync.schedule.shutdown_forced");
                cycleRunner.shutdownNow();
            }
        } catch (InterruptedException e) {
            cycleRunner.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
