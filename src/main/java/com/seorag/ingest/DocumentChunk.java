package com.seorag.ingest;

public record DocumentChunk(String id, String text, ChunkMetadata metadata) {
}
