package com.spsync.ingest;

import java.util.Map;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient, int dimension) {
        return fromEnvironment(System.getenv(), httpClient, dimension);
    }

    public static EmbeddingService fromEnvironment(Map<String, String> env, OkHttpClient httpClient, int dimension) {
        String endpoint = env.get("SPSYNC_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return new LocalModelEmbeddingService(dimension);
        }
        String provider = env.getOrDefault("SPSYNC_EMBEDDING_PROVIDER", "custom");
        String model = env.getOrDefault("SPSYNC_EMBEDDING_MODEL", "");
        String apiKey = env.get("SPSYNC_EMBEDDING_API_KEY");
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, model, apiKey, dimension);
    }
}
