package com.seorag.ingest;

import java.util.Locale;
import java.util.Set;

/**
 * Offline embedding model: hashed tokens and character trigrams, with extra weight on SEO vocabulary.
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    private static final String VERSION = "local-seo-v1";
    private static final Set<String> DOMAIN_TERMS = Set.of(
            "seo", "google", "ranking", "index", "crawl", "backlink", "keyword", "canonical",
            "eeat", "ymyl", "sitemap", "schema", "snippet", "serp", "algorithm");

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String normalized = text.toLowerCase(Locale.ROOT);
        String[] tokens = normalized.split("[^\\p{L}\\p{N}]+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addHashed(vector, "tok:" + token, 1.0f);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
            if (isSeoDomainTerm(token)) {
                addHashed(vector, "domain:" + token, 1.6f);
            }
        }

        VectorMath.normalize(vector);
        return vector;
    }

    @Override
    public String version() {
        return VERSION + "-" + dimension;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static boolean isSeoDomainTerm(String token) {
        return DOMAIN_TERMS.stream().anyMatch(token::startsWith);
    }
}
