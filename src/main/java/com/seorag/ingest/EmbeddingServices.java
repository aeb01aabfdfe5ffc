package com.seorag.ingest;

import com.seorag.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    public static EmbeddingService fromConfig(AppConfig.ProviderConfig provider, String apiKey, OkHttpClient httpClient) {
        String endpoint = provider.getEmbeddingUrl();
        if (endpoint == null || endpoint.isBlank()) {
            return new LocalModelEmbeddingService(provider.getLocalEmbeddingDimension());
        }
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider.getEmbeddingModel(), apiKey);
    }
}
