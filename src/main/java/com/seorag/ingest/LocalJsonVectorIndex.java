package com.seorag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Exact cosine-similarity store persisted as a single JSON file. Insertion order is kept so that
 * equal scores resolve the same way after every rebuild.
 */
public class LocalJsonVectorIndex implements VectorIndex {
    public static final String FILE_NAME = "vectors.json";

    private final Map<String, IndexedChunk> chunks = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void upsert(DocumentChunk chunk, float[] embedding) {
        chunks.put(chunk.id(), new IndexedChunk(chunk, embedding));
    }

    @Override
    public List<SearchResult> search(float[] queryEmbedding, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        return chunks.values().stream()
                .map(indexed -> new SearchResult(indexed.chunk(), VectorMath.cosine(queryEmbedding, indexed.embedding())))
                .sorted(Comparator.comparing(SearchResult::score).reversed())
                .limit(topK)
                .toList();
    }

    @Override
    public int size() {
        return chunks.size();
    }

    @Override
    public List<String> chunkIds() {
        return new ArrayList<>(chunks.keySet());
    }

    @Override
    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        objectMapper.writeValue(path.toFile(), new ArrayList<>(chunks.values()));
    }

    public static LocalJsonVectorIndex load(Path path) throws IOException {
        LocalJsonVectorIndex index = new LocalJsonVectorIndex();
        if (!Files.exists(path)) {
            return index;
        }
        ObjectMapper mapper = new ObjectMapper();
        List<IndexedChunk> loaded = mapper.readValue(path.toFile(), new TypeReference<List<IndexedChunk>>() {
        });
        for (IndexedChunk entry : loaded) {
            index.chunks.put(entry.chunk().id(), entry);
        }
        return index;
    }

    public record IndexedChunk(DocumentChunk chunk, float[] embedding) {
    }
}
