package com.spsync;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.spsync.cursor.StorageException;
import com.spsync.ingest.SearchResult;
import com.spsync.runtime.AppConfig;
import com.spsync.runtime.SyncRuntime;
import com.spsync.sync.SyncCycleResult;
import com.spsync.sync.SyncMode;
import com.spsync.sync.SyncScheduler;
import com.spsync.sync.SyncStatusStore;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "spsync",
        mixinStandardHelpOptions = true,
        version = "spsync 0.1.0",
        description = "Keeps a local chunk index in sync with a SharePoint document library.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_OK = 0;
    static final int EXIT_SYNC_FAILED = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "delta")
    Mode mode;

    @Option(names = "--interval-minutes", description = "Schedule interval in minutes; overrides scheduler.intervalMs")
    Long intervalMinutes;

    @Option(names = "--max-cycles", description = "Stop schedule mode after this many cycles (0 = run until stopped)")
    Long maxCycles;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return", defaultValue = "5")
    int topK;

    RuntimeFactory runtimeFactory = SyncRuntime::open;

    enum Mode {
        delta,
        full,
        schedule,
        status,
        search
    }

    @FunctionalInterface
    interface RuntimeFactory {
        SyncRuntime create(AppConfig config) throws IOException;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(configPath);
        if (intervalMinutes != null) {
            if (intervalMinutes <= 0) {
                log.error("--interval-minutes must be > 0");
                return EXIT_USAGE_ERROR;
            }
            config.getScheduler().setIntervalMs(intervalMinutes * 60_000L);
        }
        if (maxCycles != null) {
            config.getScheduler().setMaxCycles(maxCycles);
        }
        if (mode == Mode.search && (query == null || query.isBlank())) {
            log.error("--query is required in search mode");
            return EXIT_USAGE_ERROR;
        }

        log.info("Starting spsync in {} mode", mode);
        log.info("Using config file: {}", configPath);

        SyncRuntime runtime;
        try {
            runtime = runtimeFactory.create(config);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }

        try (runtime) {
            if (mode == Mode.status) {
                return printStatus(runtime);
            }
            if (mode == Mode.search) {
                return search(runtime);
            }

            List<String> missing = runtime.missingRemoteSettings();
            if (!missing.isEmpty()) {
                log.error("Graph access is not configured; set {}", missing);
                return EXIT_USAGE_ERROR;
            }
            if (mode == Mode.schedule) {
                return schedule(runtime);
            }
            return runOnce(runtime, mode == Mode.full ? SyncMode.FULL : SyncMode.DELTA);
        }
    }

    private int runOnce(SyncRuntime runtime, SyncMode syncMode) {
        try {
            SyncCycleResult result = runtime.orchestrator().runCycle(syncMode);
            runtime.statusStore().recordCycle(result);
            log.info("Sync {}: mode={} added={} updated={} deleted={} unchanged={} skipped={} failed={} pages={}",
                    result.status(),
                    result.mode(),
                    result.added(),
                    result.updated(),
                    result.deleted(),
                    result.unchanged(),
                    result.skipped(),
                    result.failed(),
                    result.pagesApplied());
            return result.successful() ? EXIT_OK : EXIT_SYNC_FAILED;
        } catch (StorageException e) {
            log.error("Sync aborted: {}", e.getMessage(), e);
            return EXIT_SYNC_FAILED;
        }
    }

    private int schedule(SyncRuntime runtime) throws InterruptedException {
        try (SyncScheduler scheduler = runtime.scheduler()) {
            Thread shutdownHook = new Thread(scheduler::stop, "spsync-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            scheduler.start();
            scheduler.awaitCompletion();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM shutdown in progress, hook stays registered");
            }
            log.info("Schedule finished: cycles={} skippedTriggers={}", scheduler.completedCycles(), scheduler.skippedTriggers());
        } catch (IllegalArgumentException e) {
            log.error("Invalid scheduler configuration: {}", e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        return EXIT_OK;
    }

    private int printStatus(SyncRuntime runtime) throws IOException {
        SyncStatusStore.SyncStatus status = runtime.statusStore().load();
        log.info("Cursor: {}", runtime.cursorStore().load().map(Object::toString).orElse("none"));
        log.info("Index: chunks={}", runtime.index().count());
        System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(status));
        return EXIT_OK;
    }

    private int search(SyncRuntime runtime) {
        List<SearchResult> results = runtime.retrievalService().retrieve(query, topK);
        if (results.isEmpty()) {
            log.info("No results for query");
        }
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            log.info("Result #{} semantic={} rerank={} citation={}",
                    i + 1,
                    String.format("%.4f", result.score()),
                    String.format("%.4f", result.rerankScore()),
                    result.citationSnippet());
        }
        return EXIT_OK;
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }
}
