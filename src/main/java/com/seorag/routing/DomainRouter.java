package com.seorag.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Labels every query with exactly one {@link SourceMix}. Anything the classifier cannot settle,
 * including a classifier failure, falls back to the static corpus.
 */
public class DomainRouter {
    private static final Logger log = LoggerFactory.getLogger(DomainRouter.class);

    private final QueryClassifier classifier;

    public DomainRouter() {
        this(new LexicalQueryClassifier());
    }

    public DomainRouter(QueryClassifier classifier) {
        this.classifier = classifier;
    }

    public SourceMix classify(String query) {
        if (query == null || query.isBlank()) {
            log.debug("route.decision label=STATIC reason=\"empty query\"");
            return SourceMix.STATIC;
        }
        RouteDecision decision;
        try {
            decision = classifier.classify(query);
        } catch (RuntimeException e) {
            log.warn("route.classifier.failed reason={} fallback=STATIC", e.getMessage());
            return SourceMix.STATIC;
        }
        if (decision == null || decision.inconclusive() || decision.label() == null) {
            log.info("route.decision label=STATIC reason=\"ambiguous: {}\"", decision == null ? "no decision" : decision.reason());
            return SourceMix.STATIC;
        }
        log.info("route.decision label={} reason=\"{}\"", decision.label(), decision.reason());
        return decision.label();
    }

    public Query route(String query) {
        return new Query(query == null ? "" : query, classify(query));
    }
}
