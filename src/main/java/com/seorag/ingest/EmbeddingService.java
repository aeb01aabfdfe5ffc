package com.seorag.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public interface EmbeddingService {
    float[] embed(String text) throws IOException;

    default List<float[]> embedBatch(List<String> texts) throws IOException {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    default String version() {
        return "legacy-v1";
    }
}
