package com.seorag.retrieval;

import java.time.Instant;

/**
 * One ranked piece of evidence. {@code score} is the value the result was ranked by; for mixed
 * results it is the per-source normalised score, while {@code rawScore} keeps the source's own
 * similarity or weighted recency.
 */
public record EvidenceUnit(
        Provenance provenance,
        double score,
        double rawScore,
        String reference,
        String title,
        String text,
        Instant publishedAt) {

    EvidenceUnit withScore(double newScore) {
        return new EvidenceUnit(provenance, newScore, rawScore, reference, title, text, publishedAt);
    }
}
