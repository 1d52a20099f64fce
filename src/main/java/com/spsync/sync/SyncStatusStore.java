package com.spsync.sync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spsync.cursor.StorageException;
import com.spsync.runtime.AtomicFileWriter;

/**
 * Operator-facing record of recent sync activity, kept as a JSON file next to the cursor.
 */
public class SyncStatusStore {
    private static final Logger log = LoggerFactory.getLogger(SyncStatusStore.class);

    private final Path path;
    private final ObjectMapper mapper = new ObjectMapper();

    public SyncStatusStore(Path path) {
        this.path = path;
    }

    public synchronized SyncStatus load() {
        if (!Files.exists(path)) {
            return new SyncStatus();
        }
        try {
            return mapper.readValue(path.toFile(), SyncStatus.class);
        } catch (IOException e) {
            log.warn("status.load.unreadable path={} reason={}", path, e.getMessage());
            return new SyncStatus();
        }
    }

    public synchronized SyncStatus recordCycle(SyncCycleResult result) throws StorageException {
        SyncStatus status = load();
        long now = System.currentTimeMillis();
        status.totalCycles++;
        switch (result.status()) {
            case COMPLETED -> {
                if (result.failed() == 0) {
                    status.successfulCycles++;
                    status.lastSuccessAtEpochMs = now;
                } else {
                    status.failedCycles++;
                }
            }
            case FAILED -> status.failedCycles++;
            case REJECTED -> status.rejectedCycles++;
            case CANCELLED -> status.cancelledCycles++;
        }
        status.lastCycleCompletedAtEpochMs = now;
        status.lastCycleStatus = result.status().name().toLowerCase(Locale.ROOT);
        status.lastRequestedMode = result.requestedMode().name();
        status.lastMode = result.mode().name();
        status.lastAdded = result.added();
        status.lastUpdated = result.updated();
        status.lastDeleted = result.deleted();
        status.lastUnchanged = result.unchanged();
        status.lastSkipped = result.skipped();
        status.lastFailed = result.failed();
        status.lastPagesApplied = result.pagesApplied();
        status.lastDurationMs = result.durationMs();
        status.lastError = result.failureReason();
        status.lastUpdatedAtEpochMs = now;
        save(status);
        return status;
    }

    public synchronized SyncStatus recordError(Exception error) throws StorageException {
        SyncStatus status = load();
        long now = System.currentTimeMillis();
        status.totalCycles++;
        status.failedCycles++;
        status.lastCycleCompletedAtEpochMs = now;
        status.lastCycleStatus = "aborted";
        status.lastError = error.getMessage();
        status.lastUpdatedAtEpochMs = now;
        save(status);
        return status;
    }

    public synchronized SyncStatus recordSkippedTrigger() throws StorageException {
        SyncStatus status = load();
        status.skippedTriggers++;
        status.lastUpdatedAtEpochMs = System.currentTimeMillis();
        save(status);
        return status;
    }

    private void save(SyncStatus status) throws StorageException {
        try {
            AtomicFileWriter.write(path, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(status));
        } catch (IOException e) {
            throw new StorageException("Unable to persist sync status to " + path, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncStatus {
        public long totalCycles;
        public long successfulCycles;
        public long failedCycles;
        public long rejectedCycles;
        public long cancelledCycles;
        public long skippedTriggers;
        public long lastCycleCompletedAtEpochMs;
        public long lastSuccessAtEpochMs;
        public String lastCycleStatus;
        public String lastRequestedMode;
        public String lastMode;
        public int lastAdded;
        public int lastUpdated;
        public int lastDeleted;
        public int lastUnchanged;
        public int lastSkipped;
        public int lastFailed;
        public int lastPagesApplied;
        public long lastDurationMs;
        public String lastError;
        public long lastUpdatedAtEpochMs;
    }
}
