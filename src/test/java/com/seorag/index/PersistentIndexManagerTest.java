package com.seorag.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.seorag.ingest.BuildFailureException;
import com.seorag.ingest.CorpusLoader;
import com.seorag.ingest.EmbeddingService;
import com.seorag.ingest.BagOfWordsEmbeddingService;
import com.seorag.ingest.IngestionPipeline;
import com.seorag.runtime.AppConfig;

class PersistentIndexManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldBuildWhenNoMarkerExists() throws Exception {
        Path corpus = writeCorpus(21);

        IndexHandle handle = manager(tempDir.resolve("index"), corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false);

        assertEquals(21, handle.buildReport().orElseThrow().documentCount());
        assertTrue(handle.buildReport().orElseThrow().chunkCount() > 0);
        assertEquals(21, handle.version().documentCount());
        assertTrue(Files.exists(tempDir.resolve("index").resolve(PersistentIndexManager.MARKER_FILE)));
    }

    @Test
    void shouldLoadValidIndexWithoutWritingToStorage() throws Exception {
        Path corpus = writeCorpus(5);
        Path indexDir = tempDir.resolve("index");
        IndexHandle built = manager(indexDir, corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false);
        Map<String, String> before = snapshot(indexDir);

        IndexHandle loaded = manager(indexDir, corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false);

        assertEquals(before, snapshot(indexDir));
        assertEquals(built.version().versionToken(), loaded.version().versionToken());
        assertEquals(built.chunkIds(), loaded.chunkIds());
        assertTrue(loaded.buildReport().isEmpty());
    }

    @Test
    void shouldTreatMissingMarkerLikeForcedRebuild() throws Exception {
        Path corpus = writeCorpus(6);

        IndexHandle withoutMarker = manager(tempDir.resolve("a"), corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false);
        IndexHandle forced = manager(tempDir.resolve("b"), corpus, new BagOfWordsEmbeddingService(64)).ensureReady(true);

        assertEquals(forced.chunkIds(), withoutMarker.chunkIds());
        assertEquals(forced.buildReport().orElseThrow().chunkCount(), withoutMarker.buildReport().orElseThrow().chunkCount());
    }

    @Test
    void shouldRebuildDeterministicallyWhenForced() throws Exception {
        Path corpus = writeCorpus(4);
        Path indexDir = tempDir.resolve("index");
        PersistentIndexManager manager = manager(indexDir, corpus, new BagOfWordsEmbeddingService(64));

        IndexHandle first = manager.ensureReady(true);
        IndexHandle second = manager.ensureReady(true);

        assertNotEquals(first.version().versionToken(), second.version().versionToken());
        assertEquals(first.chunkIds(), second.chunkIds());
        assertEquals(List.of(second.version().versionToken()), storeDirectories(indexDir));
    }

    @Test
    void shouldRejectQueriesBeforeIndexIsReady() {
        PersistentIndexManager manager = manager(tempDir.resolve("index"), tempDir, new BagOfWordsEmbeddingService(64));

        assertFalse(manager.isReady());
        assertThrows(IndexUnavailableException.class, () -> manager.query(new float[64], 3));
    }

    @Test
    void shouldKeepPriorIndexWhenRebuildFails() throws Exception {
        Path corpus = writeCorpus(3);
        Path indexDir = tempDir.resolve("index");
        SwitchableEmbeddingService embedding = new SwitchableEmbeddingService();
        PersistentIndexManager manager = manager(indexDir, corpus, embedding);
        IndexHandle prior = manager.ensureReady(false);

        embedding.failing.set(true);
        assertThrows(BuildFailureException.class, () -> manager.ensureReady(true));

        assertSame(prior, manager.current().orElseThrow());
        assertEquals(prior.version().versionToken(),
                new IndexVersionStore().read(manager.markerPath()).orElseThrow().versionToken());
        assertEquals(List.of(prior.version().versionToken()), storeDirectories(indexDir));

        embedding.failing.set(false);
        IndexHandle reloaded = manager(indexDir, corpus, embedding).ensureReady(false);
        assertEquals(prior.version().versionToken(), reloaded.version().versionToken());
    }

    @Test
    void shouldRebuildWhenEmbeddingVersionChanged() throws Exception {
        Path corpus = writeCorpus(3);
        Path indexDir = tempDir.resolve("index");
        IndexHandle original = manager(indexDir, corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false);

        IndexHandle rebuilt = manager(indexDir, corpus, new BagOfWordsEmbeddingService(32)).ensureReady(false);

        assertNotEquals(original.version().versionToken(), rebuilt.version().versionToken());
        assertEquals("bag-of-words-32", rebuilt.version().embeddingVersion());
        assertTrue(rebuilt.buildReport().isPresent());
    }

    @Test
    void shouldRebuildWhenMarkerPointsAtMissingStore() throws Exception {
        Path corpus = writeCorpus(2);
        Path indexDir = tempDir.resolve("index");
        IndexHandle original = manager(indexDir, corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false);
        Path store = indexDir.resolve(PersistentIndexManager.STORE_DIR).resolve(original.version().versionToken());
        Files.delete(store.resolve("vectors.json"));

        IndexHandle rebuilt = manager(indexDir, corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false);

        assertNotEquals(original.version().versionToken(), rebuilt.version().versionToken());
        assertEquals(original.chunkIds(), rebuilt.chunkIds());
    }

    @Test
    void shouldRemovePartialStoresLeftByInterruptedBuild() throws Exception {
        Path corpus = writeCorpus(2);
        Path indexDir = tempDir.resolve("index");
        Path orphan = indexDir.resolve(PersistentIndexManager.STORE_DIR).resolve("v0-crashed");
        Files.createDirectories(orphan);
        Files.writeString(orphan.resolve("vectors.json"), "[");

        IndexHandle handle = manager(indexDir, corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false);

        assertFalse(Files.exists(orphan));
        assertEquals(List.of(handle.version().versionToken()), storeDirectories(indexDir));
    }

    @Test
    void shouldFailBuildForEmptyCorpusUnlessAllowed() throws Exception {
        Path corpus = Files.createDirectories(tempDir.resolve("empty-corpus"));
        Path indexDir = tempDir.resolve("index");

        assertThrows(BuildFailureException.class,
                () -> manager(indexDir, corpus, new BagOfWordsEmbeddingService(64)).ensureReady(false));
        assertFalse(Files.exists(indexDir.resolve(PersistentIndexManager.MARKER_FILE)));

        AppConfig.IndexConfig config = new AppConfig.IndexConfig();
        config.setAllowEmptyCorpus(true);
        BagOfWordsEmbeddingService embedding = new BagOfWordsEmbeddingService(64);
        IndexHandle handle = new PersistentIndexManager(indexDir, corpus, config, new CorpusLoader(),
                new IngestionPipeline(new AppConfig.IngestionConfig(), embedding), embedding).ensureReady(false);
        assertEquals(0, handle.size());
    }

    @Test
    void shouldJoinInFlightBuildInsteadOfStartingAnother() throws Exception {
        Path corpus = writeCorpus(3);
        BlockingEmbeddingService embedding = new BlockingEmbeddingService();
        PersistentIndexManager manager = manager(tempDir.resolve("index"), corpus, embedding);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<IndexHandle> first = executor.submit(() -> manager.ensureReady(false));
            assertTrue(embedding.entered.await(5, TimeUnit.SECONDS));
            Future<IndexHandle> second = executor.submit(() -> manager.ensureReady(false));
            Thread.sleep(200);
            embedding.release.countDown();

            IndexHandle a = first.get(5, TimeUnit.SECONDS);
            IndexHandle b = second.get(5, TimeUnit.SECONDS);

            assertSame(a, b);
            assertEquals(1, embedding.batchCalls.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldReportSmokeTestHits() throws Exception {
        Path corpus = writeCorpus(3);
        PersistentIndexManager manager = manager(tempDir.resolve("index"), corpus, new BagOfWordsEmbeddingService(64));
        manager.ensureReady(false);

        assertEquals(1, manager.smokeTest("SEO"));
    }

    private PersistentIndexManager manager(Path indexDir, Path corpus, EmbeddingService embedding) {
        AppConfig.IngestionConfig ingestion = new AppConfig.IngestionConfig();
        ingestion.setRetryBackoffMs(0);
        return new PersistentIndexManager(
                indexDir,
                corpus,
                new AppConfig.IndexConfig(),
                new CorpusLoader(),
                new IngestionPipeline(ingestion, embedding),
                embedding);
    }

    private Path writeCorpus(int documents) throws IOException {
        Path corpus = Files.createDirectories(tempDir.resolve("corpus"));
        for (int i = 0; i < documents; i++) {
            Files.writeString(corpus.resolve(String.format("doc-%02d.md", i)),
                    "SEO note " + i + " about canonical URLs.\n\nCrawl budget guidance number " + i + ".");
        }
        return corpus;
    }

    private static Map<String, String> snapshot(Path root) throws IOException {
        Map<String, String> state = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.toList()) {
                String value = Files.isDirectory(path)
                        ? "dir"
                        : Files.size(path) + "@" + Files.getLastModifiedTime(path).toMillis();
                state.put(root.relativize(path).toString(), value);
            }
        }
        return state;
    }

    private static List<String> storeDirectories(Path indexDir) throws IOException {
        try (Stream<Path> children = Files.list(indexDir.resolve(PersistentIndexManager.STORE_DIR))) {
            return children.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }

    private static final class SwitchableEmbeddingService implements EmbeddingService {
        private final BagOfWordsEmbeddingService delegate = new BagOfWordsEmbeddingService(64);
        private final AtomicBoolean failing = new AtomicBoolean();

        @Override
        public float[] embed(String text) throws IOException {
            if (failing.get()) {
                throw new IOException("provider unavailable");
            }
            return delegate.embed(text);
        }

        @Override
        public String version() {
            return delegate.version();
        }
    }

    private static final class BlockingEmbeddingService implements EmbeddingService {
        private final BagOfWordsEmbeddingService delegate = new BagOfWordsEmbeddingService(64);
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicInteger batchCalls = new AtomicInteger();

        @Override
        public float[] embed(String text) {
            return delegate.embed(text);
        }

        @Override
        public List<float[]> embedBatch(List<String> texts) throws IOException {
            batchCalls.incrementAndGet();
            entered.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IOException("test latch never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
            return EmbeddingService.super.embedBatch(texts);
        }

        @Override
        public String version() {
            return delegate.version();
        }
    }
}
