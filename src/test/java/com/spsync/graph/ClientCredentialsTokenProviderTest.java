package com.spsync.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import com.spsync.feed.TransientRemoteException;

import okhttp3.FormBody;
import okhttp3.OkHttpClient;

class ClientCredentialsTokenProviderTest {
    private static final String AUTHORITY = "https://login.example/";

    @Test
    void shouldPostClientCredentialsForm() throws Exception {
        CannedGraph graph = new CannedGraph()
                .on("/tenant-1/oauth2/v2.0/token", 200, "{\"access_token\": \"tok-1\", \"expires_in\": 3600}");

        String token = provider(graph.client(), new MutableClock()).accessToken();

        assertEquals("tok-1", token);
        assertEquals("https://login.example/tenant-1/oauth2/v2.0/token", graph.requests().get(0).url().toString());
        FormBody form = (FormBody) graph.requests().get(0).body();
        assertEquals("client_credentials", valueOf(form, "grant_type"));
        assertEquals("client-1", valueOf(form, "client_id"));
        assertEquals(ClientCredentialsTokenProvider.GRAPH_SCOPE, valueOf(form, "scope"));
    }

    @Test
    void shouldReuseTokenUntilShortlyBeforeExpiry() throws Exception {
        CannedGraph graph = new CannedGraph()
                .on("/oauth2/v2.0/token", 200, "{\"access_token\": \"tok-1\", \"expires_in\": 600}");
        MutableClock clock = new MutableClock();
        ClientCredentialsTokenProvider provider = provider(graph.client(), clock);

        provider.accessToken();
        clock.advance(Duration.ofSeconds(500));
        provider.accessToken();
        assertEquals(1, graph.requests().size());

        clock.advance(Duration.ofSeconds(50));
        provider.accessToken();
        assertEquals(2, graph.requests().size());
    }

    @Test
    void shouldTreatTokenEndpointErrorAsTransient() {
        CannedGraph graph = new CannedGraph().on("/oauth2/v2.0/token", 401, "{\"error\": \"invalid_client\"}");

        TransientRemoteException error = assertThrows(TransientRemoteException.class,
                () -> provider(graph.client(), new MutableClock()).accessToken());
        assertEquals(401, error.statusCode());
    }

    @Test
    void shouldRejectResponseWithoutToken() {
        CannedGraph graph = new CannedGraph().on("/oauth2/v2.0/token", 200, "{\"token_type\": \"Bearer\"}");

        assertThrows(TransientRemoteException.class, () -> provider(graph.client(), new MutableClock()).accessToken());
    }

    @Test
    void shouldRequireCredentials() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new ClientCredentialsTokenProvider(new OkHttpClient(), AUTHORITY, "tenant-1", "client-1", " "));
        assertTrue(error.getMessage().contains("client secret"));
    }

    private static ClientCredentialsTokenProvider provider(OkHttpClient client, Clock clock) {
        return new ClientCredentialsTokenProvider(client, AUTHORITY, "tenant-1", "client-1", "secret-1", clock);
    }

    private static String valueOf(FormBody form, String name) {
        for (int i = 0; i < form.size(); i++) {
            if (form.name(i).equals(name)) {
                return form.value(i);
            }
        }
        return null;
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
