package com.spsync.graph;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.spsync.cursor.SyncCursor;
import com.spsync.feed.ChangeFeedClient;
import com.spsync.feed.ChangePage;
import com.spsync.feed.ChangeRecord;
import com.spsync.feed.FeedSession;
import com.spsync.feed.RemoteItem;
import com.spsync.feed.TransientRemoteException;

/**
 * Change feed over {@code GET /drives/{drive}/root/delta}. Every page is turned into change records;
 * the page cursor is the {@code @odata.nextLink} for intermediate pages and the
 * {@code @odata.deltaLink} for the last one. Folders are not reported. Files outside the configured
 * scan folders are reported as deletions, so moving a file out of scope removes its chunks.
 */
public class GraphChangeFeedClient implements ChangeFeedClient {
    private static final Logger log = LoggerFactory.getLogger(GraphChangeFeedClient.class);
    static final String OCTET_STREAM = "application/octet-stream";
    private static final Map<String, String> CONTENT_TYPES_BY_EXTENSION = Map.ofEntries(
            Map.entry("txt", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("csv", "text/csv"),
            Map.entry("htm", "text/html"),
            Map.entry("html", "text/html"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("doc", "application/msword"),
            Map.entry("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
            Map.entry("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"));

    private final GraphClient graphClient;
    private final List<String> scanFolders;

    public GraphChangeFeedClient(GraphClient graphClient, List<String> scanFolders) {
        this.graphClient = graphClient;
        this.scanFolders = scanFolders.stream()
                .map(GraphChangeFeedClient::trimSlashes)
                .filter(folder -> !folder.isEmpty())
                .map(folder -> folder.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public FeedSession open(Optional<SyncCursor> cursor) throws IOException {
        String firstUrl = cursor.isPresent()
                ? cursor.get().token()
                : "drives/" + graphClient.driveId() + "/root/delta";
        GraphFeedSession session = new GraphFeedSession(cursor.isEmpty());
        session.prefetch(firstUrl);
        return session;
    }

    private ChangePage fetchPage(String url, GraphFeedSession session) throws IOException {
        JsonNode body = graphClient.getJson(url);
        List<ChangeRecord> records = new ArrayList<>();
        for (JsonNode entry : body.path("value")) {
            toRecord(entry).ifPresent(records::add);
        }

        String nextLink = body.path("@odata.nextLink").asText("");
        String deltaLink = body.path("@odata.deltaLink").asText("");
        if (!nextLink.isBlank()) {
            session.nextUrl = nextLink;
            return new ChangePage(records, SyncCursor.of(nextLink), true);
        }
        if (!deltaLink.isBlank()) {
            session.nextUrl = null;
            return new ChangePage(records, SyncCursor.of(deltaLink), false);
        }
        throw new TransientRemoteException("Delta response carried neither a nextLink nor a deltaLink", 200);
    }

    Optional<ChangeRecord> toRecord(JsonNode entry) {
        String id = entry.path("id").asText("");
        if (id.isBlank()) {
            return Optional.empty();
        }
        if (entry.has("deleted")) {
            return Optional.of(ChangeRecord.deletion(id));
        }
        if (!entry.has("file")) {
            return Optional.empty();
        }

        String folderPath = folderPath(entry.path("parentReference").path("path").asText(""));
        if (!inScope(folderPath)) {
            log.debug("graph.delta.out_of_scope id={} folder={}", id, folderPath);
            return Optional.of(ChangeRecord.deletion(id));
        }

        String name = entry.path("name").asText("");
        String contentTag = entry.path("cTag").asText("");
        if (contentTag.isBlank()) {
            contentTag = entry.path("eTag").asText("");
        }
        RemoteItem item = new RemoteItem(
                id,
                name,
                folderPath,
                contentTag,
                contentType(entry.path("file").path("mimeType").asText(""), name),
                entry.path("size").asLong(0L),
                parseInstant(entry.path("lastModifiedDateTime").asText("")),
                entry.path("webUrl").asText(""));
        return Optional.of(ChangeRecord.upsert(item));
    }

    static String folderPath(String parentPath) {
        int rootMarker = parentPath.indexOf("root:");
        if (rootMarker < 0) {
            return "";
        }
        return trimSlashes(parentPath.substring(rootMarker + "root:".length()));
    }

    static String contentType(String mimeType, String name) {
        if (!mimeType.isBlank() && !OCTET_STREAM.equalsIgnoreCase(mimeType)) {
            return mimeType;
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return OCTET_STREAM;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return CONTENT_TYPES_BY_EXTENSION.getOrDefault(extension, OCTET_STREAM);
    }

    private boolean inScope(String folderPath) {
        if (scanFolders.isEmpty()) {
            return true;
        }
        String folder = folderPath.toLowerCase(Locale.ROOT);
        return scanFolders.stream().anyMatch(scope -> folder.equals(scope) || folder.startsWith(scope + "/"));
    }

    private static Instant parseInstant(String value) {
        if (value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("graph.delta.bad_timestamp value={}", value);
            return null;
        }
    }

    private static String trimSlashes(String value) {
        String trimmed = value.strip();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private final class GraphFeedSession implements FeedSession {
        private final boolean fullEnumeration;
        private ChangePage prefetched;
        private String nextUrl;

        private GraphFeedSession(boolean fullEnumeration) {
            this.fullEnumeration = fullEnumeration;
        }

        private void prefetch(String url) throws IOException {
            prefetched = fetchPage(url, this);
        }

        @Override
        public boolean hasNextPage() {
            return prefetched != null || nextUrl != null;
        }

        @Override
        public ChangePage nextPage() throws IOException {
            if (prefetched != null) {
                ChangePage page = prefetched;
                prefetched = null;
                return page;
            }
            if (nextUrl == null) {
                throw new NoSuchElementException("delta feed exhausted");
            }
            return fetchPage(nextUrl, this);
        }

        @Override
        public boolean fullEnumeration() {
            return fullEnumeration;
        }
    }
}
