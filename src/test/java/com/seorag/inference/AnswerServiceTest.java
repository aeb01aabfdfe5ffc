package com.seorag.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.seorag.feeds.FeedAggregator;
import com.seorag.feeds.FeedClient;
import com.seorag.feeds.FeedSourceException;
import com.seorag.index.PersistentIndexManager;
import com.seorag.ingest.CorpusLoader;
import com.seorag.ingest.EmbeddingService;
import com.seorag.ingest.BagOfWordsEmbeddingService;
import com.seorag.ingest.IngestionPipeline;
import com.seorag.retrieval.RetrievalFusionRanker;
import com.seorag.routing.DomainRouter;
import com.seorag.routing.RouteDecision;
import com.seorag.routing.SourceMix;
import com.seorag.runtime.AppConfig;

class AnswerServiceTest {
    private static final FeedClient NO_FEEDS = source -> {
        throw new FeedSourceException(source.name(), "offline");
    };

    @TempDir
    Path tempDir;

    private final EmbeddingService embedding = new BagOfWordsEmbeddingService(64);
    private final DomainRouter staticRouter = new DomainRouter(query -> RouteDecision.of(SourceMix.STATIC, "test"));

    @Test
    void shouldAnswerFromRetrievedEvidence() throws Exception {
        PersistentIndexManager manager = manager(writeCorpus(3), false);
        manager.ensureReady(false);
        RecordingCompletionService completion = new RecordingCompletionService("Use a canonical tag.");

        try (FeedAggregator aggregator = new FeedAggregator(new AppConfig.FeedConfig(), NO_FEEDS)) {
            Answer answer = service(manager, aggregator, completion).ask("How should duplicate pages point to a canonical URL?", 2);

            assertEquals(AnswerStatus.ANSWERED, answer.status());
            assertEquals("Use a canonical tag.", answer.text());
            assertEquals(2, answer.evidence().size());
            assertEquals(1, completion.userPrompts.size());
            assertTrue(completion.userPrompts.get(0).contains("## Knowledge base"));
            assertTrue(completion.userPrompts.get(0).endsWith("Question: How should duplicate pages point to a canonical URL?"));
        }
    }

    @Test
    void shouldReportIndexNotReadyAsRetryable() throws Exception {
        PersistentIndexManager manager = manager(writeCorpus(1), false);
        RecordingCompletionService completion = new RecordingCompletionService("unused");

        try (FeedAggregator aggregator = new FeedAggregator(new AppConfig.FeedConfig(), NO_FEEDS)) {
            Answer answer = service(manager, aggregator, completion).ask("What is a sitemap?", 3);

            assertEquals(AnswerStatus.INDEX_NOT_READY, answer.status());
            assertTrue(answer.status().retryable());
            assertEquals(AnswerService.INDEX_NOT_READY_MESSAGE, answer.text());
            assertTrue(completion.userPrompts.isEmpty());
        }
    }

    @Test
    void shouldReportNoEvidenceWithoutCallingTheModel() throws Exception {
        Path emptyCorpus = Files.createDirectories(tempDir.resolve("empty"));
        PersistentIndexManager manager = manager(emptyCorpus, true);
        manager.ensureReady(false);
        RecordingCompletionService completion = new RecordingCompletionService("unused");

        try (FeedAggregator aggregator = new FeedAggregator(new AppConfig.FeedConfig(), NO_FEEDS)) {
            Answer answer = service(manager, aggregator, completion).ask("What is a sitemap?", 3);

            assertEquals(AnswerStatus.NO_EVIDENCE, answer.status());
            assertFalse(answer.status().retryable());
            assertEquals(AnswerService.NO_EVIDENCE_MESSAGE, answer.text());
            assertTrue(completion.userPrompts.isEmpty());
        }
    }

    @Test
    void shouldReportNoEvidenceWhenNothingInThePopulatedIndexIsSimilar() throws Exception {
        PersistentIndexManager manager = manager(writeCorpus(3), false);
        manager.ensureReady(false);
        RecordingCompletionService completion = new RecordingCompletionService("unused");

        try (FeedAggregator aggregator = new FeedAggregator(new AppConfig.FeedConfig(), NO_FEEDS)) {
            Answer answer = service(manager, aggregator, completion).ask("hreflang tags for multilingual sites", 3);

            assertEquals(AnswerStatus.NO_EVIDENCE, answer.status());
            assertTrue(answer.evidence().isEmpty());
            assertTrue(completion.userPrompts.isEmpty());
        }
    }

    @Test
    void shouldDeclineQuestionsOutsideSeoWithoutRetrievalOrModelCall() throws Exception {
        PersistentIndexManager manager = manager(writeCorpus(1), false);
        RecordingCompletionService completion = new RecordingCompletionService("unused");

        try (FeedAggregator aggregator = new FeedAggregator(new AppConfig.FeedConfig(), NO_FEEDS)) {
            Answer answer = service(manager, aggregator, completion).ask("Best pasta recipe for dinner?", 3);

            assertEquals(AnswerStatus.OFF_TOPIC, answer.status());
            assertFalse(answer.status().retryable());
            assertEquals(AnswerService.OFF_TOPIC_MESSAGE, answer.text());
            assertTrue(answer.evidence().isEmpty());
            assertTrue(completion.userPrompts.isEmpty());
        }
    }

    @Test
    void shouldConsultTheInjectedTopicClassifier() throws Exception {
        PersistentIndexManager manager = manager(writeCorpus(1), false);
        RetrievalFusionRanker ranker = new RetrievalFusionRanker(
                manager, embedding, null, List::of, new AppConfig.RetrievalConfig());
        RecordingCompletionService completion = new RecordingCompletionService("unused");

        Answer answer = new AnswerService(staticRouter, query -> false, ranker, completion).ask("What is a sitemap?", 3);

        assertEquals(AnswerStatus.OFF_TOPIC, answer.status());
        assertTrue(completion.userPrompts.isEmpty());
    }

    @Test
    void shouldKeepEvidenceWhenCompletionFails() throws Exception {
        PersistentIndexManager manager = manager(writeCorpus(2), false);
        manager.ensureReady(false);
        CompletionService failing = (system, user) -> {
            throw new CompletionException("HTTP 502 from completion endpoint");
        };

        try (FeedAggregator aggregator = new FeedAggregator(new AppConfig.FeedConfig(), NO_FEEDS)) {
            Answer answer = service(manager, aggregator, failing).ask("How should duplicate pages point to a canonical URL?", 2);

            assertEquals(AnswerStatus.UPSTREAM_ERROR, answer.status());
            assertTrue(answer.status().retryable());
            assertEquals(2, answer.evidence().size());
        }
    }

    private AnswerService service(PersistentIndexManager manager, FeedAggregator aggregator, CompletionService completion) {
        RetrievalFusionRanker ranker = new RetrievalFusionRanker(
                manager, embedding, aggregator, List::of, new AppConfig.RetrievalConfig());
        return new AnswerService(staticRouter, ranker, completion);
    }

    private PersistentIndexManager manager(Path corpus, boolean allowEmptyCorpus) {
        AppConfig.IndexConfig indexConfig = new AppConfig.IndexConfig();
        indexConfig.setAllowEmptyCorpus(allowEmptyCorpus);
        AppConfig.IngestionConfig ingestion = new AppConfig.IngestionConfig();
        ingestion.setRetryBackoffMs(0);
        return new PersistentIndexManager(
                tempDir.resolve("index"),
                corpus,
                indexConfig,
                new CorpusLoader(),
                new IngestionPipeline(ingestion, embedding),
                embedding);
    }

    private Path writeCorpus(int documents) throws IOException {
        Path corpus = Files.createDirectories(tempDir.resolve("corpus"));
        for (int i = 0; i < documents; i++) {
            Files.writeString(corpus.resolve("duplicates-" + i + ".md"),
                    "Duplicate pages should point to one canonical URL. Note " + i + ".");
        }
        return corpus;
    }

    private static final class RecordingCompletionService implements CompletionService {
        private final String reply;
        private final List<String> userPrompts = new ArrayList<>();

        private RecordingCompletionService(String reply) {
            this.reply = reply;
        }

        @Override
        public String complete(String systemPrompt, String userPrompt) {
            userPrompts.add(userPrompt);
            return reply;
        }
    }
}
