package com.seorag.ingest;

import java.util.List;

public record BuildReport(
        int documentCount,
        long totalCharacters,
        int chunkCount,
        int batchCount,
        int chunkSize,
        int batchSize,
        String embeddingVersion,
        List<String> emptyDocuments) {

    /**
     * An all-zero report for a non-empty document set means nothing usable was produced.
     */
    public boolean isEmptyOutput() {
        return chunkCount == 0 || totalCharacters == 0L;
    }
}
