package com.seorag.ingest;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.seorag.runtime.AppConfig;

public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final AppConfig.IngestionConfig config;
    private final EmbeddingService embeddingService;

    public IngestionPipeline(AppConfig.IngestionConfig config, EmbeddingService embeddingService) {
        this.config = config;
        this.embeddingService = embeddingService;
    }

    public BuildReport build(List<Document> documents, VectorIndex target) throws BuildFailureException {
        long totalChars = documents.stream().mapToLong(document -> document.text().length()).sum();
        boolean largeCorpus = totalChars > config.getLargeCorpusThresholdChars();
        int chunkSize = largeCorpus ? config.getLargeCorpusChunkSize() : config.getChunkSize();
        int batchSize = largeCorpus
                ? Math.max(1, Math.min(config.getBatchSize() / 2, 25))
                : Math.max(1, config.getBatchSize());
        int overlap = Math.min(Math.max(0, config.getChunkOverlap()), chunkSize - 1);
        if (largeCorpus) {
            log.warn("ingest.large-corpus totalChars={} chunkSize={} batchSize={}", totalChars, chunkSize, batchSize);
        } else {
            log.info("ingest.policy totalChars={} chunkSize={} overlap={} batchSize={}", totalChars, chunkSize, overlap, batchSize);
        }

        Chunker chunker = new Chunker(chunkSize, overlap);
        List<DocumentChunk> allChunks = new ArrayList<>();
        List<String> emptyDocuments = new ArrayList<>();
        for (Document document : documents) {
            List<DocumentChunk> chunks = chunker.chunk(document);
            if (chunks.isEmpty()) {
                emptyDocuments.add(document.id());
            }
            log.info("ingest.document id={} chars={} chunks={}", document.id(), document.text().length(), chunks.size());
            allChunks.addAll(chunks);
        }

        int batchCount = 0;
        for (int start = 0; start < allChunks.size(); start += batchSize) {
            List<DocumentChunk> batch = allChunks.subList(start, Math.min(allChunks.size(), start + batchSize));
            batchCount++;
            List<float[]> vectors = embedWithRetries(batch, batchCount);
            for (int i = 0; i < batch.size(); i++) {
                target.upsert(batch.get(i), vectors.get(i));
            }
            log.debug("ingest.batch number={} size={}", batchCount, batch.size());
        }

        return new BuildReport(
                documents.size(),
                totalChars,
                allChunks.size(),
                batchCount,
                chunkSize,
                batchSize,
                embeddingService.version(),
                List.copyOf(emptyDocuments));
    }

    private List<float[]> embedWithRetries(List<DocumentChunk> batch, int batchNumber) throws BuildFailureException {
        List<String> texts = batch.stream().map(DocumentChunk::text).toList();
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                List<float[]> vectors = embeddingService.embedBatch(texts);
                if (vectors.size() != texts.size()) {
                    throw new IOException("expected " + texts.size() + " vectors but got " + vectors.size());
                }
                return vectors;
            } catch (IOException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long backoff = config.getRetryBackoffMs() * attempt;
                log.warn("ingest.batch.retry batch={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        batchNumber, attempt, maxAttempts, backoff, e.getMessage());
                sleep(backoff);
            }
        }
        throw new BuildFailureException("Embedding batch " + batchNumber + " failed after " + maxAttempts + " attempts", last);
    }

    private static void sleep(long millis) throws BuildFailureException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildFailureException("Build interrupted while backing off", e);
        }
    }
}
