package com.seorag.ingest;

public record SearchResult(DocumentChunk chunk, float score) {
}
