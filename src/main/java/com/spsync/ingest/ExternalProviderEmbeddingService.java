package com.spsync.ingest;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Calls an HTTP embedding endpoint. Accepts either {@code {"embedding": [...]}} or the OpenAI shape
 * {@code {"data": [{"embedding": [...]}]}}. Any failure surfaces as {@link EmbeddingException} so the
 * owning item is marked failed instead of being indexed with a degraded vector.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String provider;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String model,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.provider = provider;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        try {
            Map<String, String> body = model == null || model.isBlank()
                    ? Map.of("input", text)
                    : Map.of("input", text, "model", model);
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    throw new EmbeddingException("Embedding provider " + provider + " answered HTTP " + response.code());
                }
                return parseVector(mapper.readTree(responseBody.string()));
            }
        } catch (IOException e) {
            throw new EmbeddingException("Embedding provider " + provider + " unreachable: " + e.getMessage(), e);
        }
    }

    private float[] parseVector(JsonNode root) {
        JsonNode vectorNode = root.path("embedding");
        if (!vectorNode.isArray()) {
            vectorNode = root.path("data").path(0).path("embedding");
        }
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw new EmbeddingException("Embedding provider " + provider + " returned no vector");
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + provider + (model == null || model.isBlank() ? "" : "-" + model) + "-v1";
    }
}
