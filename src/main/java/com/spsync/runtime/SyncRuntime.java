package com.spsync.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.spsync.cursor.JsonFileCursorStore;
import com.spsync.feed.ChangeFeedClient;
import com.spsync.feed.ContentFetcher;
import com.spsync.graph.ClientCredentialsTokenProvider;
import com.spsync.graph.GraphChangeFeedClient;
import com.spsync.graph.GraphClient;
import com.spsync.graph.GraphContentFetcher;
import com.spsync.ingest.ChunkerRegistry;
import com.spsync.ingest.EmbeddingService;
import com.spsync.ingest.EmbeddingServices;
import com.spsync.ingest.LocalJsonChunkIndex;
import com.spsync.ingest.RetrievalService;
import com.spsync.sync.Reconciler;
import com.spsync.sync.SyncOrchestrator;
import com.spsync.sync.SyncScheduler;
import com.spsync.sync.SyncStatusStore;

import okhttp3.OkHttpClient;

/**
 * Wires the engine from configuration. Local components (index, cursor, status, retrieval) are
 * created eagerly; the Graph side is created on first use so that the status and search modes run
 * without credentials.
 */
public class SyncRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncRuntime.class);
    static final String TENANT_ID = "SPSYNC_TENANT_ID";
    static final String CLIENT_ID = "SPSYNC_CLIENT_ID";
    static final String CLIENT_SECRET = "SPSYNC_CLIENT_SECRET";

    private final AppConfig config;
    private final Map<String, String> env;
    private final OkHttpClient httpClient;
    private final EmbeddingService embeddingService;
    private final LocalJsonChunkIndex index;
    private final JsonFileCursorStore cursorStore;
    private final SyncStatusStore statusStore;
    private final RetrievalService retrievalService;

    private ChangeFeedClient feedClient;
    private ContentFetcher contentFetcher;
    private Reconciler reconciler;
    private SyncOrchestrator orchestrator;

    public static SyncRuntime open(AppConfig config) throws IOException {
        return new SyncRuntime(config, System.getenv(), null, null);
    }

    /**
     * @param feedClient     change feed to use, or null to build the Graph feed from configuration
     * @param contentFetcher content fetcher to use, or null to build the Graph fetcher from configuration
     */
    public SyncRuntime(AppConfig config,
            Map<String, String> env,
            ChangeFeedClient feedClient,
            ContentFetcher contentFetcher) throws IOException {
        validateConfig(config);
        this.config = config;
        this.env = env;
        this.feedClient = feedClient;
        this.contentFetcher = contentFetcher;
        AppConfig.GraphConfig graph = config.getGraph();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(graph.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(graph.getReadTimeoutMs()))
                .callTimeout(Duration.ofMillis(graph.getCallTimeoutMs()))
                .build();
        this.embeddingService = EmbeddingServices.fromEnvironment(env, httpClient, config.getIndex().getEmbeddingDimension());
        this.index = LocalJsonChunkIndex.open(Path.of(config.getIndex().getPath()), embeddingService);
        this.cursorStore = new JsonFileCursorStore(Path.of(config.getSync().getCursorPath()));
        this.statusStore = new SyncStatusStore(Path.of(config.getSync().getStatusPath()));
        this.retrievalService = new RetrievalService(index, embeddingService);
        log.info("runtime.ready index={} cursor={} embedding={}",
                config.getIndex().getPath(), config.getSync().getCursorPath(), embeddingService.version());
    }

    /**
     * Settings the Graph side still needs, empty when a sync can run.
     */
    public List<String> missingRemoteSettings() {
        List<String> missing = new ArrayList<>();
        if (feedClient != null && contentFetcher != null) {
            return missing;
        }
        for (String name : List.of(TENANT_ID, CLIENT_ID, CLIENT_SECRET)) {
            String value = env.get(name);
            if (value == null || value.isBlank()) {
                missing.add(name);
            }
        }
        AppConfig.GraphConfig graph = config.getGraph();
        if (graph.getDriveId().isBlank() && graph.getSiteHostname().isBlank()) {
            missing.add("graph.driveId or graph.siteHostname");
        }
        return missing;
    }

    public synchronized SyncOrchestrator orchestrator() {
        if (orchestrator != null) {
            return orchestrator;
        }
        if (feedClient == null || contentFetcher == null) {
            List<String> missing = missingRemoteSettings();
            if (!missing.isEmpty()) {
                throw new IllegalStateException("Graph access is not configured; missing " + missing);
            }
            AppConfig.GraphConfig graph = config.getGraph();
            ClientCredentialsTokenProvider tokenProvider = new ClientCredentialsTokenProvider(
                    httpClient,
                    graph.getAuthorityBaseUrl(),
                    env.get(TENANT_ID),
                    env.get(CLIENT_ID),
                    env.get(CLIENT_SECRET));
            GraphClient graphClient = new GraphClient(httpClient, graph, tokenProvider);
            if (feedClient == null) {
                feedClient = new GraphChangeFeedClient(graphClient, graph.getScanFolders());
            }
            if (contentFetcher == null) {
                contentFetcher = new GraphContentFetcher(graphClient);
            }
        }
        AppConfig.SyncConfig sync = config.getSync();
        reconciler = new Reconciler(
                index,
                cursorStore,
                contentFetcher,
                ChunkerRegistry.textDefaults(config.getChunking()),
                sync.getWorkerThreads(),
                sync.getMaxItemRetries(),
                sync.getRetryBackoffMs());
        reconciler.addListener(retrievalService);
        orchestrator = new SyncOrchestrator(feedClient, cursorStore, index, reconciler);
        return orchestrator;
    }

    public SyncScheduler scheduler() {
        return new SyncScheduler(orchestrator(), statusStore, config.getScheduler());
    }

    public LocalJsonChunkIndex index() {
        return index;
    }

    public JsonFileCursorStore cursorStore() {
        return cursorStore;
    }

    public SyncStatusStore statusStore() {
        return statusStore;
    }

    public RetrievalService retrievalService() {
        return retrievalService;
    }

    static void validateConfig(AppConfig config) {
        AppConfig.SyncConfig sync = config.getSync();
        if (sync.getWorkerThreads() <= 0) {
            throw new IllegalArgumentException("sync.workerThreads must be > 0");
        }
        if (sync.getMaxItemRetries() < 0 || sync.getRetryBackoffMs() < 0) {
            throw new IllegalArgumentException("sync.maxItemRetries and sync.retryBackoffMs must be >= 0");
        }
        AppConfig.ChunkingConfig chunking = config.getChunking();
        if (chunking.getChunkSize() <= 0 || chunking.getChunkOverlap() < 0 || chunking.getChunkOverlap() >= chunking.getChunkSize()) {
            throw new IllegalArgumentException("chunking requires chunkSize > 0 and 0 <= chunkOverlap < chunkSize");
        }
        if (config.getIndex().getEmbeddingDimension() <= 0) {
            throw new IllegalArgumentException("index.embeddingDimension must be > 0");
        }
    }

    @Override
    public synchronized void close() {
        if (reconciler != null) {
            reconciler.close();
        }
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
