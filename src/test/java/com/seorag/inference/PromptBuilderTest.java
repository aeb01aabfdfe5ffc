package com.seorag.inference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.seorag.retrieval.EvidenceUnit;
import com.seorag.retrieval.Provenance;
import com.seorag.retrieval.RetrievalResult;
import com.seorag.routing.SourceMix;

class PromptBuilderTest {
    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void shouldListCorpusPassagesBeforeDatedFeedItems() {
        List<EvidenceUnit> evidence = new ArrayList<>();
        evidence.add(new EvidenceUnit(Provenance.FEED, 1.0, 0.9, "https://example.com/core", "Core update done",
                "The March core update finished.", Instant.parse("2026-03-20T08:00:00Z")));
        for (int i = 0; i < 7; i++) {
            evidence.add(new EvidenceUnit(Provenance.STATIC_INDEX, 0.5, 0.5, "docs/guide.md#" + i, "docs/guide.md",
                    "Passage " + i, null));
        }
        RetrievalResult result = new RetrievalResult("core update", SourceMix.BOTH, evidence,
                EnumSet.allOf(Provenance.class), Map.of(), false);

        String prompt = builder.userPrompt("  What changed?  ", result);

        assertTrue(prompt.indexOf("## Knowledge base") < prompt.indexOf("## Latest information"));
        assertTrue(prompt.contains("[guide]"));
        assertTrue(prompt.contains("Passage 4"));
        assertFalse(prompt.contains("Passage 5"));
        assertTrue(prompt.contains("[Core update done (2026-03-20)] https://example.com/core"));
        assertTrue(prompt.endsWith("Question: What changed?"));
    }

    @Test
    void shouldDeriveDisplayNameFromDocumentId() {
        assertEquals("technical-seo", PromptBuilder.displayName("corpus/technical-seo.md"));
        assertEquals("notes", PromptBuilder.displayName("notes"));
        assertEquals("document", PromptBuilder.displayName(" "));
    }
}
