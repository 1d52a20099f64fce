package com.spsync.graph;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spsync.feed.TransientRemoteException;

import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * OAuth2 client-credentials flow against the Microsoft identity platform. The token is cached and
 * renewed once it is within {@link #EXPIRY_MARGIN} of expiring.
 */
public class ClientCredentialsTokenProvider implements AccessTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsTokenProvider.class);
    static final String GRAPH_SCOPE = "https://graph.microsoft.com/.default";
    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Clock clock;

    private String cachedToken;
    private Instant refreshAfter = Instant.MIN;

    public ClientCredentialsTokenProvider(OkHttpClient httpClient,
            String authorityBaseUrl,
            String tenantId,
            String clientId,
            String clientSecret) {
        this(httpClient, authorityBaseUrl, tenantId, clientId, clientSecret, Clock.systemUTC());
    }

    ClientCredentialsTokenProvider(OkHttpClient httpClient,
            String authorityBaseUrl,
            String tenantId,
            String clientId,
            String clientSecret,
            Clock clock) {
        if (isBlank(tenantId) || isBlank(clientId) || isBlank(clientSecret)) {
            throw new IllegalStateException("Tenant id, client id and client secret are required for Graph access");
        }
        this.httpClient = httpClient;
        this.tokenUrl = stripTrailingSlash(authorityBaseUrl) + "/" + tenantId + "/oauth2/v2.0/token";
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.clock = clock;
    }

    @Override
    public synchronized String accessToken() throws IOException {
        Instant now = clock.instant();
        if (cachedToken != null && now.isBefore(refreshAfter)) {
            return cachedToken;
        }

        Request request = new Request.Builder()
                .url(tokenUrl)
                .post(new FormBody.Builder()
                        .add("grant_type", "client_credentials")
                        .add("client_id", clientId)
                        .add("client_secret", clientSecret)
                        .add("scope", GRAPH_SCOPE)
                        .build())
                .build();

        JsonNode body;
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new TransientRemoteException("Token endpoint answered HTTP " + response.code(), response.code());
            }
            body = mapper.readTree(responseBody.string());
        } catch (TransientRemoteException e) {
            throw e;
        } catch (IOException e) {
            throw new TransientRemoteException("Token request failed: " + e.getMessage(), e);
        }

        String token = body.path("access_token").asText("");
        if (token.isBlank()) {
            throw new TransientRemoteException("Token response carried no access_token", 200);
        }
        long expiresIn = body.path("expires_in").asLong(3600);
        cachedToken = token;
        refreshAfter = now.plusSeconds(expiresIn).minus(EXPIRY_MARGIN);
        log.debug("graph.token.acquired expires_in={}s", expiresIn);
        return cachedToken;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
