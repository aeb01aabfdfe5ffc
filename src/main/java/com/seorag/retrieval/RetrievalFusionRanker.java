package com.seorag.retrieval;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.seorag.feeds.FeedAggregator;
import com.seorag.feeds.FeedFetchResult;
import com.seorag.feeds.FeedItem;
import com.seorag.feeds.FeedSource;
import com.seorag.index.IndexUnavailableException;
import com.seorag.index.PersistentIndexManager;
import com.seorag.ingest.EmbeddingService;
import com.seorag.ingest.SearchResult;
import com.seorag.routing.Query;
import com.seorag.routing.SourceMix;
import com.seorag.runtime.AppConfig;

/**
 * Retrieves evidence from the static index, the live feeds, or both, and ranks it into one list.
 *
 * <p>Static chunks below {@code minSimilarity} are dropped, and feed articles that fail the
 * {@link ArticleRelevanceFilter} never become evidence.
 *
 * <p>Feed items are scored {@code categoryWeight * recency * (0.5 + 0.5 * termOverlap)} where
 * recency halves every {@code recencyHalfLifeHours}. When both sources are consulted, each
 * source's scores are min-max normalised on their own before merging; at equal normalised score a
 * static chunk ranks ahead of a feed item.
 */
public class RetrievalFusionRanker {
    private static final Logger log = LoggerFactory.getLogger(RetrievalFusionRanker.class);

    private final PersistentIndexManager indexManager;
    private final EmbeddingService embeddingService;
    private final FeedAggregator feedAggregator;
    private final Supplier<List<FeedSource>> feedSources;
    private final AppConfig.RetrievalConfig config;
    private final ArticleRelevanceFilter relevanceFilter;
    private final Clock clock;

    public RetrievalFusionRanker(
            PersistentIndexManager indexManager,
            EmbeddingService embeddingService,
            FeedAggregator feedAggregator,
            Supplier<List<FeedSource>> feedSources,
            AppConfig.RetrievalConfig config) {
        this(indexManager, embeddingService, feedAggregator, feedSources, config, Clock.systemUTC());
    }

    RetrievalFusionRanker(
            PersistentIndexManager indexManager,
            EmbeddingService embeddingService,
            FeedAggregator feedAggregator,
            Supplier<List<FeedSource>> feedSources,
            AppConfig.RetrievalConfig config,
            Clock clock) {
        this.indexManager = indexManager;
        this.embeddingService = embeddingService;
        this.feedAggregator = feedAggregator;
        this.feedSources = feedSources;
        this.config = config;
        this.relevanceFilter = new ArticleRelevanceFilter(config.getFeedRelevance());
        this.clock = clock;
    }

    public RetrievalResult retrieve(Query query, int k) throws IOException {
        return retrieve(query.text(), query.label(), k);
    }

    /**
     * @throws IndexUnavailableException for {@link SourceMix#STATIC} before the index is ready
     * @throws IOException when the query cannot be embedded
     */
    public RetrievalResult retrieve(String query, SourceMix requested, int k) throws IOException {
        String text = query == null ? "" : query;
        SourceMix label = requested == null ? SourceMix.STATIC : requested;
        Set<Provenance> attempted = EnumSet.noneOf(Provenance.class);
        if (k <= 0) {
            return new RetrievalResult(text, label, List.of(), attempted, Map.of(), false);
        }

        List<EvidenceUnit> staticEvidence = List.of();
        List<EvidenceUnit> feedEvidence = List.of();
        Map<String, String> feedFailures = new LinkedHashMap<>();
        boolean staticUnavailable = false;

        if (label == SourceMix.STATIC || label == SourceMix.BOTH) {
            try {
                staticEvidence = retrieveStatic(text, k);
                attempted.add(Provenance.STATIC_INDEX);
            } catch (IndexUnavailableException e) {
                if (label == SourceMix.STATIC) {
                    throw e;
                }
                staticUnavailable = true;
                log.warn("retrieval.static.unavailable query=\"{}\" reason={} fallback=feeds", abbreviate(text), e.getMessage());
            }
        }
        if (label == SourceMix.LIVE || label == SourceMix.BOTH) {
            feedEvidence = retrieveLive(text, feedFailures);
            attempted.add(Provenance.FEED);
        }

        List<EvidenceUnit> ranked = switch (label) {
            case STATIC -> staticEvidence;
            case LIVE -> feedEvidence;
            case BOTH -> fuse(staticEvidence, feedEvidence);
        };
        List<EvidenceUnit> bounded = ranked.subList(0, Math.min(k, ranked.size()));
        log.info("retrieval.result label={} static={} feed={} returned={} feedFailures={} staticUnavailable={}",
                label, staticEvidence.size(), feedEvidence.size(), bounded.size(), feedFailures.size(), staticUnavailable);
        return new RetrievalResult(text, label, bounded, attempted, feedFailures, staticUnavailable);
    }

    private List<EvidenceUnit> retrieveStatic(String query, int k) throws IOException {
        if (!indexManager.isReady()) {
            throw new IndexUnavailableException("Index is not ready; ensureReady has not completed");
        }
        float[] vector = embeddingService.embed(query);
        List<EvidenceUnit> evidence = new ArrayList<>();
        int belowThreshold = 0;
        for (SearchResult result : indexManager.query(vector, k)) {
            if (result.score() < config.getMinSimilarity()) {
                belowThreshold++;
                continue;
            }
            evidence.add(new EvidenceUnit(
                    Provenance.STATIC_INDEX,
                    result.score(),
                    result.score(),
                    result.chunk().id(),
                    result.chunk().metadata().documentId(),
                    result.chunk().text(),
                    null));
        }
        if (belowThreshold > 0) {
            log.debug("retrieval.static.filtered belowMinSimilarity={} minSimilarity={}", belowThreshold, config.getMinSimilarity());
        }
        return evidence;
    }

    private List<EvidenceUnit> retrieveLive(String query, Map<String, String> failures) {
        Instant now = clock.instant();
        Map<FeedSource, FeedFetchResult> results = feedAggregator.fetch(feedSources.get(), now);
        Set<String> queryTerms = terms(query);
        Set<String> seenLinks = new HashSet<>();
        List<EvidenceUnit> evidence = new ArrayList<>();
        int irrelevant = 0;
        for (FeedFetchResult result : results.values()) {
            if (!result.isSuccess()) {
                failures.put(result.source().name(), result.failureReason());
                continue;
            }
            for (FeedItem item : result.items()) {
                if (!relevanceFilter.isRelevant(query, item)) {
                    irrelevant++;
                    continue;
                }
                if (item.link() != null && !item.link().isBlank() && !seenLinks.add(item.link())) {
                    continue;
                }
                double score = scoreFeedItem(item, queryTerms, now);
                evidence.add(new EvidenceUnit(
                        Provenance.FEED,
                        score,
                        score,
                        item.link(),
                        item.title(),
                        item.text(),
                        item.publishedAt()));
            }
        }
        if (irrelevant > 0) {
            log.debug("retrieval.feed.filtered irrelevant={}", irrelevant);
        }
        evidence.sort(Comparator.comparingDouble(EvidenceUnit::score).reversed());
        return evidence;
    }

    double scoreFeedItem(FeedItem item, Set<String> queryTerms, Instant now) {
        return item.categoryWeight() * recency(item.publishedAt(), now) * (0.5 + 0.5 * termOverlap(queryTerms, item));
    }

    double recency(Instant publishedAt, Instant now) {
        if (publishedAt == null) {
            return config.getUndatedRecency();
        }
        double ageHours = Math.max(0, Duration.between(publishedAt, now).toMinutes() / 60.0);
        return Math.pow(0.5, ageHours / Math.max(1e-6, config.getRecencyHalfLifeHours()));
    }

    private static double termOverlap(Set<String> queryTerms, FeedItem item) {
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> itemTerms = terms(item.text());
        long shared = queryTerms.stream().filter(itemTerms::contains).count();
        return (double) shared / queryTerms.size();
    }

    static Set<String> terms(String text) {
        Set<String> terms = new HashSet<>();
        if (text == null) {
            return terms;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() >= 2) {
                terms.add(token);
            }
        }
        return terms;
    }

    /**
     * Merges two independently ranked lists. Ordering: normalised score descending, then static
     * before feed, then raw score descending, then original position.
     */
    static List<EvidenceUnit> fuse(List<EvidenceUnit> staticEvidence, List<EvidenceUnit> feedEvidence) {
        List<Candidate> candidates = new ArrayList<>();
        List<EvidenceUnit> normalizedStatic = normalize(staticEvidence);
        List<EvidenceUnit> normalizedFeed = normalize(feedEvidence);
        for (int i = 0; i < normalizedStatic.size(); i++) {
            candidates.add(new Candidate(normalizedStatic.get(i), i));
        }
        for (int i = 0; i < normalizedFeed.size(); i++) {
            candidates.add(new Candidate(normalizedFeed.get(i), normalizedStatic.size() + i));
        }
        candidates.sort(Comparator
                .comparingDouble((Candidate candidate) -> candidate.unit().score()).reversed()
                .thenComparing(candidate -> candidate.unit().provenance())
                .thenComparing(Comparator.comparingDouble((Candidate candidate) -> candidate.unit().rawScore()).reversed())
                .thenComparingInt(Candidate::position));
        return candidates.stream().map(Candidate::unit).toList();
    }

    static List<EvidenceUnit> normalize(List<EvidenceUnit> evidence) {
        if (evidence.isEmpty()) {
            return evidence;
        }
        double min = evidence.stream().mapToDouble(EvidenceUnit::rawScore).min().orElse(0);
        double max = evidence.stream().mapToDouble(EvidenceUnit::rawScore).max().orElse(0);
        double range = max - min;
        List<EvidenceUnit> normalized = new ArrayList<>(evidence.size());
        for (EvidenceUnit unit : evidence) {
            normalized.add(unit.withScore(range <= 0 ? 1.0 : (unit.rawScore() - min) / range));
        }
        return normalized;
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }

    private record Candidate(EvidenceUnit unit, int position) {
    }
}
