package com.seorag.inference;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

import com.seorag.retrieval.EvidenceUnit;
import com.seorag.retrieval.Provenance;
import com.seorag.retrieval.RetrievalResult;

/**
 * Lays retrieved evidence out as a grounded prompt: knowledge-base passages first, then the latest
 * feed items with their publication dates.
 */
public class PromptBuilder {
    static final int MAX_CORPUS_PASSAGES = 5;
    static final int MAX_FEED_ITEMS = 3;
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    static final String SYSTEM_PROMPT = """
            You are an SEO specialist assistant.
            Answer using the reference material below as the primary source.
            Combine information from several passages where relevant and propose concrete, practical measures.
            When the latest information section is present, prefer it for anything time-sensitive and mention the date.
            Say so plainly when the material does not cover the question instead of guessing.
            """;

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String userPrompt(String question, RetrievalResult result) {
        StringBuilder prompt = new StringBuilder();
        List<EvidenceUnit> corpus = result.evidence().stream()
                .filter(unit -> unit.provenance() == Provenance.STATIC_INDEX)
                .limit(MAX_CORPUS_PASSAGES)
                .toList();
        List<EvidenceUnit> feeds = result.evidence().stream()
                .filter(unit -> unit.provenance() == Provenance.FEED)
                .limit(MAX_FEED_ITEMS)
                .toList();

        if (!corpus.isEmpty()) {
            prompt.append("## Knowledge base\n");
            for (EvidenceUnit unit : corpus) {
                prompt.append("[").append(displayName(unit.title())).append("]\n")
                        .append(unit.text().strip()).append("\n\n");
            }
        }
        if (!feeds.isEmpty()) {
            prompt.append("## Latest information\n");
            for (EvidenceUnit unit : feeds) {
                prompt.append("[").append(unit.title());
                if (unit.publishedAt() != null) {
                    prompt.append(" (").append(DATE.format(unit.publishedAt())).append(")");
                }
                prompt.append("] ").append(unit.reference() == null ? "" : unit.reference()).append("\n")
                        .append(unit.text().strip()).append("\n\n");
            }
        }
        prompt.append("Question: ").append(question.strip());
        return prompt.toString();
    }

    /**
     * File name without directories or extension, as operators know the corpus documents by name.
     */
    static String displayName(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            return "document";
        }
        String name = documentId.substring(Math.max(documentId.lastIndexOf('/'), documentId.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
