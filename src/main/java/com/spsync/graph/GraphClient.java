package com.spsync.graph;

import java.io.IOException;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spsync.feed.ContentNotFoundException;
import com.spsync.feed.CursorExpiredException;
import com.spsync.feed.TransientRemoteException;
import com.spsync.runtime.AppConfig;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Authenticated GET access to Microsoft Graph with the status mapping shared by the feed and the
 * content fetcher: 410 means the delta cursor expired, 404 means the item is gone, anything else
 * that is not 2xx is transient.
 */
public class GraphClient {
    private static final Logger log = LoggerFactory.getLogger(GraphClient.class);

    private final OkHttpClient httpClient;
    private final AppConfig.GraphConfig config;
    private final AccessTokenProvider tokenProvider;
    private final ObjectMapper mapper = new ObjectMapper();
    private volatile String driveId;

    public GraphClient(OkHttpClient httpClient, AppConfig.GraphConfig config, AccessTokenProvider tokenProvider) {
        this.httpClient = httpClient;
        this.config = config;
        this.tokenProvider = tokenProvider;
        if (config.getDriveId() != null && !config.getDriveId().isBlank()) {
            this.driveId = config.getDriveId();
        }
    }

    public JsonNode getJson(String pathOrUrl) throws IOException {
        return mapper.readTree(get(pathOrUrl));
    }

    public byte[] getBytes(String pathOrUrl) throws IOException {
        return get(pathOrUrl);
    }

    /**
     * Resolves the document library once: the configured drive id when set, otherwise the drive of
     * the configured site whose name matches {@code driveName}.
     */
    public String driveId() throws IOException {
        String resolved = driveId;
        if (resolved != null) {
            return resolved;
        }
        synchronized (this) {
            if (driveId == null) {
                driveId = lookupDriveId();
            }
            return driveId;
        }
    }

    private String lookupDriveId() throws IOException {
        if (config.getSiteHostname().isBlank()) {
            throw new IllegalStateException("graph.siteHostname or graph.driveId must be configured");
        }
        String sitePath = config.getSitePath().startsWith("/") ? config.getSitePath() : "/" + config.getSitePath();
        JsonNode site = getJson("sites/" + config.getSiteHostname() + ":" + sitePath);
        String siteId = site.path("id").asText("");
        if (siteId.isBlank()) {
            throw new TransientRemoteException("Site lookup returned no id for " + config.getSiteHostname() + sitePath, 200);
        }

        JsonNode drives = getJson("sites/" + siteId + "/drives").path("value");
        String wanted = config.getDriveName().toLowerCase(Locale.ROOT);
        for (JsonNode drive : drives) {
            if (wanted.equals(drive.path("name").asText("").toLowerCase(Locale.ROOT))) {
                String id = drive.path("id").asText();
                log.info("graph.drive.resolved site={} drive={} id={}", siteId, config.getDriveName(), id);
                return id;
            }
        }
        throw new IllegalStateException("No drive named '" + config.getDriveName() + "' on site " + siteId);
    }

    private byte[] get(String pathOrUrl) throws IOException {
        String url = resolve(pathOrUrl);
        Request request = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + tokenProvider.accessToken())
                .header("Accept", "application/json")
                .get()
                .build();

        int status;
        byte[] body;
        try (Response response = httpClient.newCall(request).execute()) {
            status = response.code();
            ResponseBody responseBody = response.body();
            body = responseBody == null ? new byte[0] : responseBody.bytes();
        } catch (IOException e) {
            throw new TransientRemoteException("GET " + url + " failed: " + e.getMessage(), e);
        }

        if (status >= 200 && status < 300) {
            return body;
        }
        if (status == 410) {
            throw new CursorExpiredException("Delta cursor rejected with HTTP 410");
        }
        if (status == 404) {
            throw new ContentNotFoundException("GET " + url + " answered HTTP 404");
        }
        throw new TransientRemoteException("GET " + url + " answered HTTP " + status, status);
    }

    private String resolve(String pathOrUrl) {
        if (pathOrUrl.startsWith("https://") || pathOrUrl.startsWith("http://")) {
            return pathOrUrl;
        }
        String base = ClientCredentialsTokenProvider.stripTrailingSlash(config.getBaseUrl());
        return base + (pathOrUrl.startsWith("/") ? pathOrUrl : "/" + pathOrUrl);
    }
}
