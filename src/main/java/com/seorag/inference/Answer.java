package com.seorag.inference;

import java.util.List;

import com.seorag.retrieval.EvidenceUnit;

public record Answer(AnswerStatus status, String text, List<EvidenceUnit> evidence) {
    public Answer {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
