package com.spsync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.spsync.feed.ChangeRecord;
import com.spsync.feed.MapContentFetcher;
import com.spsync.feed.ScriptedChangeFeed;
import com.spsync.runtime.SyncRuntime;
import com.spsync.sync.SyncStatusStore;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReportStatusWithoutCredentials() throws IOException {
        Main main = mainWith(null, null);

        assertEquals(Main.EXIT_OK, new CommandLine(main).execute("--config", writeConfig().toString(), "--mode", "status"));
    }

    @Test
    void shouldRequireQueryInSearchMode() throws IOException {
        Main main = mainWith(null, null);

        assertEquals(Main.EXIT_USAGE_ERROR, new CommandLine(main).execute("--config", writeConfig().toString(), "--mode", "search"));
    }

    @Test
    void shouldRefuseSyncWithoutGraphSettings() throws IOException {
        Main main = mainWith(null, null);

        assertEquals(Main.EXIT_USAGE_ERROR, new CommandLine(main).execute("--config", writeConfig().toString(), "--mode", "delta"));
    }

    @Test
    void shouldRejectNonPositiveInterval() throws IOException {
        Main main = mainWith(null, null);

        assertEquals(Main.EXIT_USAGE_ERROR, new CommandLine(main).execute(
                "--config", writeConfig().toString(), "--mode", "schedule", "--interval-minutes", "0"));
    }

    @Test
    void shouldRunDeltaCycleAndRecordStatus() throws IOException {
        ScriptedChangeFeed feed = new ScriptedChangeFeed()
                .thenSession(ScriptedChangeFeed.page("delta-1", false,
                        ChangeRecord.upsert(ScriptedChangeFeed.textItem("A", "a1")),
                        ChangeRecord.upsert(ScriptedChangeFeed.textItem("B", "b1"))));
        MapContentFetcher fetcher = new MapContentFetcher().put("A", "alpha").put("B", "beta");

        int exitCode = new CommandLine(mainWith(feed, fetcher)).execute("--config", writeConfig().toString());

        assertEquals(Main.EXIT_OK, exitCode);
        SyncStatusStore.SyncStatus status = new SyncStatusStore(tempDir.resolve("status.json")).load();
        assertEquals(1, status.successfulCycles);
        assertEquals("FULL", status.lastMode);
        assertEquals(2, status.lastAdded);
        assertTrue(Files.exists(tempDir.resolve("cursor.json")));
    }

    @Test
    void shouldExitWithFailureWhenItemsFail() throws IOException {
        ScriptedChangeFeed feed = new ScriptedChangeFeed()
                .thenSession(ScriptedChangeFeed.page("delta-1", false,
                        ChangeRecord.upsert(ScriptedChangeFeed.textItem("A", "a1"))));
        MapContentFetcher fetcher = new MapContentFetcher();

        int exitCode = new CommandLine(mainWith(feed, fetcher)).execute("--config", writeConfig().toString(), "--mode", "full");

        assertEquals(Main.EXIT_SYNC_FAILED, exitCode);
        assertEquals(1, new SyncStatusStore(tempDir.resolve("status.json")).load().failedCycles);
    }

    @Test
    void shouldRunBoundedSchedule() throws IOException {
        ScriptedChangeFeed feed = new ScriptedChangeFeed()
                .thenSession(ScriptedChangeFeed.page("delta-1", false,
                        ChangeRecord.upsert(ScriptedChangeFeed.textItem("A", "a1"))));
        MapContentFetcher fetcher = new MapContentFetcher().put("A", "alpha");

        int exitCode = new CommandLine(mainWith(feed, fetcher)).execute(
                "--config", writeConfig().toString(), "--mode", "schedule", "--max-cycles", "1");

        assertEquals(Main.EXIT_OK, exitCode);
        assertEquals(1, new SyncStatusStore(tempDir.resolve("status.json")).load().totalCycles);
    }

    private Main mainWith(ScriptedChangeFeed feed, MapContentFetcher fetcher) {
        Main main = new Main();
        main.runtimeFactory = config -> new SyncRuntime(config, Map.of(), feed, fetcher);
        return main;
    }

    private Path writeConfig() throws IOException {
        Path config = tempDir.resolve("spsync.yml");
        Files.writeString(config, """
                sync:
                  workerThreads: 2
                  cursorPath: %s
                  statusPath: %s
                index:
                  path: %s
                  embeddingDimension: 32
                """.formatted(
                quoted(tempDir.resolve("cursor.json")),
                quoted(tempDir.resolve("status.json")),
                quoted(tempDir.resolve("index.json"))));
        return config;
    }

    private static String quoted(Path path) {
        return "'" + path.toString().replace("'", "''") + "'";
    }
}
