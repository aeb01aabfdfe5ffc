package com.seorag.routing;

/**
 * Classifier verdict. An inconclusive decision carries no usable label and is resolved by the
 * router to {@link SourceMix#STATIC}.
 */
public record RouteDecision(SourceMix label, String reason, boolean inconclusive) {
    public static RouteDecision of(SourceMix label, String reason) {
        return new RouteDecision(label, reason, false);
    }

    public static RouteDecision ambiguous(String reason) {
        return new RouteDecision(null, reason, true);
    }
}
