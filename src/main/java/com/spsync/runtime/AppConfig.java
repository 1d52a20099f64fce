package com.spsync.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private GraphConfig graph = new GraphConfig();
    private SyncConfig sync = new SyncConfig();
    private IndexConfig index = new IndexConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();

    public GraphConfig getGraph() {
        return graph;
    }

    public void setGraph(GraphConfig graph) {
        this.graph = graph == null ? new GraphConfig() : graph;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync == null ? new SyncConfig() : sync;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public SchedulerConfig getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerConfig scheduler) {
        this.scheduler = scheduler == null ? new SchedulerConfig() : scheduler;
    }

    /**
     * Microsoft Graph endpoint, drive selection and per-call timeouts. Credentials are not part of
     * the file; they come from {@code SPSYNC_TENANT_ID}, {@code SPSYNC_CLIENT_ID} and
     * {@code SPSYNC_CLIENT_SECRET}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GraphConfig {
        private String baseUrl = "https://graph.microsoft.com/v1.0";
        private String authorityBaseUrl = "https://login.microsoftonline.com";
        private String siteHostname = "";
        private String sitePath = "";
        private String driveName = "Documents";
        private String driveId = "";
        private List<String> scanFolders = new ArrayList<>();
        private int connectTimeoutMs = 10000;
        private int readTimeoutMs = 30000;
        private int callTimeoutMs = 120000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getAuthorityBaseUrl() {
            return authorityBaseUrl;
        }

        public void setAuthorityBaseUrl(String authorityBaseUrl) {
            this.authorityBaseUrl = authorityBaseUrl;
        }

        public String getSiteHostname() {
            return siteHostname;
        }

        public void setSiteHostname(String siteHostname) {
            this.siteHostname = siteHostname;
        }

        public String getSitePath() {
            return sitePath;
        }

        public void setSitePath(String sitePath) {
            this.sitePath = sitePath;
        }

        public String getDriveName() {
            return driveName;
        }

        public void setDriveName(String driveName) {
            this.driveName = driveName;
        }

        public String getDriveId() {
            return driveId;
        }

        public void setDriveId(String driveId) {
            this.driveId = driveId;
        }

        public List<String> getScanFolders() {
            return scanFolders;
        }

        public void setScanFolders(List<String> scanFolders) {
            this.scanFolders = scanFolders == null ? new ArrayList<>() : scanFolders;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public int getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(int callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SyncConfig {
        private int workerThreads = 4;
        private int maxItemRetries = 0;
        private long retryBackoffMs = 2000;
        private String cursorPath = ".spsync/delta-cursor.json";
        private String statusPath = ".spsync/sync-status.json";

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getMaxItemRetries() {
            return maxItemRetries;
        }

        public void setMaxItemRetries(int maxItemRetries) {
            this.maxItemRetries = maxItemRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public String getCursorPath() {
            return cursorPath;
        }

        public void setCursorPath(String cursorPath) {
            this.cursorPath = cursorPath;
        }

        public String getStatusPath() {
            return statusPath;
        }

        public void setStatusPath(String statusPath) {
            this.statusPath = statusPath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String path = ".spsync/chunk-index.json";
        private int embeddingDimension = 384;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getEmbeddingDimension() {
            return embeddingDimension;
        }

        public void setEmbeddingDimension(int embeddingDimension) {
            this.embeddingDimension = embeddingDimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int chunkSize = 1000;
        private int chunkOverlap = 200;
        private List<String> textContentTypes = new ArrayList<>(List.of(
                "text/plain",
                "text/markdown",
                "text/csv",
                "text/html",
                "application/json",
                "application/xml"));

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public List<String> getTextContentTypes() {
            return textContentTypes;
        }

        public void setTextContentTypes(List<String> textContentTypes) {
            this.textContentTypes = textContentTypes == null ? new ArrayList<>() : textContentTypes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SchedulerConfig {
        private long intervalMs = 21_600_000;
        private long initialDelayMs = 0;
        private long maxCycles = 0;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaxCycles() {
            return maxCycles;
        }

        public void setMaxCycles(long maxCycles) {
            this.maxCycles = maxCycles;
        }
    }
}
