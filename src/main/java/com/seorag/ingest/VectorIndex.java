package com.seorag.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface VectorIndex {
    void upsert(DocumentChunk chunk, float[] embedding);

    List<SearchResult> search(float[] queryEmbedding, int topK);

    int size();

    List<String> chunkIds();

    void save(Path path) throws IOException;
}
