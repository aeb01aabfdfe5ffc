package com.seorag.ingest;

public record ChunkMetadata(
        String documentId,
        String sourcePath,
        int ordinal,
        int charLength) {
}
