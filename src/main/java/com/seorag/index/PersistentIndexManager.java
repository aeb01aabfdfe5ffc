package com.seorag.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.seorag.ingest.BuildFailureException;
import com.seorag.ingest.BuildReport;
import com.seorag.ingest.CorpusLoader;
import com.seorag.ingest.EmbeddingService;
import com.seorag.ingest.IngestionPipeline;
import com.seorag.ingest.LocalJsonVectorIndex;
import com.seorag.ingest.SearchResult;
import com.seorag.runtime.AppConfig;

/**
 * Owns the persisted index: decides whether an existing version can be reused, runs builds one at a
 * time, and hands out read-only {@link IndexHandle}s.
 *
 * <p>Layout under the index directory:
 * <pre>
 * index-version.json          active marker, replaced atomically after a build completes
 * store/&lt;versionToken&gt;/vectors.json
 * </pre>
 * A marker is only written once its store directory is complete, so after a crash the marker is
 * either absent or still points at the previous complete store.
 */
public class PersistentIndexManager {
    private static final Logger log = LoggerFactory.getLogger(PersistentIndexManager.class);
    static final String MARKER_FILE = "index-version.json";
    static final String STORE_DIR = "store";

    private final Path indexDir;
    private final Path corpusDir;
    private final AppConfig.IndexConfig config;
    private final CorpusLoader corpusLoader;
    private final IngestionPipeline pipeline;
    private final EmbeddingService embeddingService;
    private final IndexVersionStore versionStore = new IndexVersionStore();

    private final ReentrantLock buildLock = new ReentrantLock();
    private CompletableFuture<IndexHandle> inFlight;
    private volatile IndexHandle active;

    public PersistentIndexManager(
            Path indexDir,
            Path corpusDir,
            AppConfig.IndexConfig config,
            CorpusLoader corpusLoader,
            IngestionPipeline pipeline,
            EmbeddingService embeddingService) {
        this.indexDir = indexDir;
        this.corpusDir = corpusDir;
        this.config = config;
        this.corpusLoader = corpusLoader;
        this.pipeline = pipeline;
        this.embeddingService = embeddingService;
    }

    /**
     * Resolves the index state and builds when required. A caller arriving while another caller's
     * resolution is in flight waits for that outcome instead of starting a second build.
     */
    public IndexHandle ensureReady(boolean force) throws BuildFailureException {
        CompletableFuture<IndexHandle> pending;
        boolean owner = false;
        buildLock.lock();
        try {
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                owner = true;
            }
            pending = inFlight;
        } finally {
            buildLock.unlock();
        }

        if (!owner) {
            log.info("index.ensure-ready waiting for in-flight build");
            return await(pending);
        }

        try {
            IndexHandle handle = resolve(force);
            pending.complete(handle);
            return handle;
        } catch (BuildFailureException | RuntimeException e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            buildLock.lock();
            try {
                inFlight = null;
            } finally {
                buildLock.unlock();
            }
        }
    }

    public List<SearchResult> query(float[] vector, int k) {
        return current()
                .orElseThrow(() -> new IndexUnavailableException("Index is not ready; ensureReady has not completed"))
                .query(vector, k);
    }

    public Optional<IndexHandle> current() {
        return Optional.ofNullable(active);
    }

    public boolean isReady() {
        return active != null;
    }

    /**
     * Runs one sample retrieval against the active index and returns the number of hits.
     */
    public int smokeTest(String sampleQuery) throws IOException {
        float[] vector = embeddingService.embed(sampleQuery);
        return query(vector, 1).size();
    }

    Path markerPath() {
        return indexDir.resolve(MARKER_FILE);
    }

    private IndexHandle resolve(boolean force) throws BuildFailureException {
        IndexState state = inspect();
        log.info("index.state result={} reason={}", state.status(), state.reason());

        if (state.usable() && !force) {
            IndexHandle current = active;
            if (current != null && current.version().versionToken().equals(state.version().versionToken())) {
                log.info("index.decision rebuild=false reason=\"active index already loaded\" version={}",
                        state.version().versionToken());
                return current;
            }
            try {
                IndexHandle loaded = load(state.version());
                log.info("index.decision rebuild=false reason=\"valid index found\" version={} chunks={}",
                        state.version().versionToken(), loaded.size());
                active = loaded;
                return loaded;
            } catch (IOException e) {
                log.warn("index.load.failed version={} reason={}", state.version().versionToken(), e.getMessage());
                return build(state.version(), "existing index could not be loaded: " + e.getMessage());
            }
        }

        String reason = state.usable() ? "forced rebuild requested" : state.reason();
        return build(state.version(), reason);
    }

    private IndexState inspect() {
        Optional<IndexVersion> marker;
        try {
            marker = versionStore.read(markerPath());
        } catch (IOException e) {
            return new IndexState(IndexState.Status.MISSING, "version marker unreadable: " + e.getMessage(), null);
        }
        if (marker.isEmpty()) {
            return new IndexState(IndexState.Status.MISSING, "version marker not found", null);
        }
        IndexVersion version = marker.get();
        if (!Files.isRegularFile(storeFile(version.versionToken()))) {
            return new IndexState(IndexState.Status.MISSING, "vector store directory missing for " + version.versionToken(), version);
        }
        if (!config.getFormatVersion().equals(version.formatVersion())) {
            return new IndexState(IndexState.Status.INCOMPATIBLE,
                    "index format " + version.formatVersion() + " differs from " + config.getFormatVersion(), version);
        }
        if (!embeddingService.version().equals(version.embeddingVersion())) {
            return new IndexState(IndexState.Status.INCOMPATIBLE,
                    "embedding model " + version.embeddingVersion() + " differs from " + embeddingService.version(), version);
        }
        return new IndexState(IndexState.Status.VALID, "valid index found (format " + version.formatVersion() + ")", version);
    }

    private IndexHandle load(IndexVersion version) throws IOException {
        LocalJsonVectorIndex store = LocalJsonVectorIndex.load(storeFile(version.versionToken()));
        return new IndexHandle(version, store, null);
    }

    private IndexHandle build(IndexVersion previous, String reason) throws BuildFailureException {
        log.info("index.decision rebuild=true reason=\"{}\"", reason);
        String keepToken = previous == null ? null : previous.versionToken();
        removePartialStores(keepToken);

        CorpusLoader.CorpusLoad corpus = corpusLoader.load(corpusDir);
        if (corpus.documents().isEmpty() && !config.isAllowEmptyCorpus()) {
            throw new BuildFailureException("No documents found in corpus directory " + corpusDir.toAbsolutePath().normalize());
        }

        String token = newVersionToken();
        Path storeDir = storeDir(token);
        LocalJsonVectorIndex store = new LocalJsonVectorIndex();
        try {
            BuildReport report = pipeline.build(corpus.documents(), store);
            log.info("index.build.report documents={} characters={} chunks={} batches={} emptyDocuments={} loadFailures={}",
                    report.documentCount(),
                    report.totalCharacters(),
                    report.chunkCount(),
                    report.batchCount(),
                    report.emptyDocuments().size(),
                    corpus.failures().size());
            if (!corpus.documents().isEmpty() && report.isEmptyOutput()) {
                throw new BuildFailureException("Build produced no chunks for " + report.documentCount() + " documents");
            }

            store.save(storeFile(token));
            IndexVersion version = new IndexVersion(
                    token,
                    Instant.now(),
                    config.getFormatVersion(),
                    report.embeddingVersion(),
                    report.documentCount(),
                    report.chunkCount());
            versionStore.commit(markerPath(), version);

            IndexHandle handle = new IndexHandle(version, store, report);
            active = handle;
            removePartialStores(token);
            log.info("index.build.complete version={} documents={} chunks={}", token, report.documentCount(), report.chunkCount());
            return handle;
        } catch (BuildFailureException e) {
            deleteStore(storeDir);
            throw e;
        } catch (IOException e) {
            deleteStore(storeDir);
            throw new BuildFailureException("Unable to persist index version " + token, e);
        }
    }

    private void removePartialStores(String keepToken) {
        Path stores = indexDir.resolve(STORE_DIR);
        if (!Files.isDirectory(stores)) {
            return;
        }
        List<Path> stale;
        try (Stream<Path> children = Files.list(stores)) {
            stale = children
                    .filter(path -> keepToken == null || !path.getFileName().toString().equals(keepToken))
                    .toList();
        } catch (IOException e) {
            log.warn("index.cleanup.failed dir={} reason={}", stores, e.getMessage());
            return;
        }
        stale.forEach(this::deleteStore);
    }

    private void deleteStore(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
            log.debug("index.cleanup.removed dir={}", dir);
        } catch (IOException e) {
            log.warn("index.cleanup.failed dir={} reason={}", dir, e.getMessage());
        }
    }

    private Path storeDir(String token) {
        return indexDir.resolve(STORE_DIR).resolve(token);
    }

    private Path storeFile(String token) {
        return storeDir(token).resolve(LocalJsonVectorIndex.FILE_NAME);
    }

    private static String newVersionToken() {
        return "v" + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static IndexHandle await(CompletableFuture<IndexHandle> pending) throws BuildFailureException {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildFailureException("Interrupted while waiting for in-flight build", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BuildFailureException failure) {
                throw failure;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BuildFailureException("In-flight build failed", cause);
        }
    }
}
