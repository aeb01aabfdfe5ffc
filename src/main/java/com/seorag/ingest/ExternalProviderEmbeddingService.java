package com.seorag.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * OpenAI-compatible embeddings endpoint. Failures surface as {@link IOException}; there is no silent
 * fallback to another model because mixing vector spaces would corrupt the index.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient, String endpoint, String model, String apiKey) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public float[] embed(String text) throws IOException {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) throws IOException {
        String payload = mapper.writeValueAsString(Map.of("model", model, "input", texts));
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("Embedding request failed with HTTP " + response.code());
            }
            JsonNode data = mapper.readTree(response.body().string()).path("data");
            if (!data.isArray() || data.size() != texts.size()) {
                throw new IOException("Embedding response did not contain " + texts.size() + " vectors");
            }
            List<float[]> vectors = new ArrayList<>(texts.size());
            for (int i = 0; i < texts.size(); i++) {
                vectors.add(null);
            }
            for (JsonNode item : data) {
                int index = item.path("index").asInt(-1);
                JsonNode vectorNode = item.path("embedding");
                if (index < 0 || index >= texts.size() || !vectorNode.isArray()) {
                    throw new IOException("Malformed embedding entry at index " + index);
                }
                float[] out = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    out[i] = (float) vectorNode.get(i).asDouble();
                }
                vectors.set(index, out);
            }
            if (vectors.contains(null)) {
                throw new IOException("Embedding response skipped some inputs");
            }
            return vectors;
        }
    }

    @Override
    public String version() {
        return "external-" + model + "-v1";
    }
}
