package com.seorag.index;

import java.util.List;
import java.util.Optional;

import com.seorag.ingest.BuildReport;
import com.seorag.ingest.SearchResult;
import com.seorag.ingest.VectorIndex;

/**
 * Read-only view of one complete index version. Safe for any number of concurrent readers.
 */
public final class IndexHandle {
    private final IndexVersion version;
    private final VectorIndex store;
    private final BuildReport buildReport;

    IndexHandle(IndexVersion version, VectorIndex store, BuildReport buildReport) {
        this.version = version;
        this.store = store;
        this.buildReport = buildReport;
    }

    public IndexVersion version() {
        return version;
    }

    /**
     * Report of the build that produced this handle; empty when an existing index was loaded.
     */
    public Optional<BuildReport> buildReport() {
        return Optional.ofNullable(buildReport);
    }

    public int size() {
        return store.size();
    }

    public List<String> chunkIds() {
        return store.chunkIds();
    }

    public List<SearchResult> query(float[] vector, int k) {
        return store.search(vector, k);
    }
}
