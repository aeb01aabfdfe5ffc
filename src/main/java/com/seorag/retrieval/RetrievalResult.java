package com.seorag.retrieval;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.seorag.routing.SourceMix;

/**
 * Ranked evidence for one query. An empty evidence list is a normal outcome; {@code attempted}
 * records which sources were actually consulted.
 */
public record RetrievalResult(
        String query,
        SourceMix label,
        List<EvidenceUnit> evidence,
        Set<Provenance> attempted,
        Map<String, String> feedFailures,
        boolean staticUnavailable) {

    public RetrievalResult {
        evidence = List.copyOf(evidence);
        attempted = Set.copyOf(attempted);
        feedFailures = Map.copyOf(feedFailures);
    }

    public boolean isEmpty() {
        return evidence.isEmpty();
    }
}
