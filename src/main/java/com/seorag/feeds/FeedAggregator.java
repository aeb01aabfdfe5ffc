package com.seorag.feeds;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.seorag.runtime.AppConfig;

/**
 * Polls feed sources in parallel and turns their entries into weighted {@link FeedItem}s.
 *
 * <p>Each selected source gets its own timeout; a slow or failing source yields a failure result
 * for that source only. Raw entries are cached per URL together with the instant they were
 * fetched, and category weights are applied on the way out of the cache.
 */
public class FeedAggregator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FeedAggregator.class);
    private static final double UNKNOWN_CATEGORY_WEIGHT = 0.5;

    private final AppConfig.FeedConfig config;
    private final FeedClient client;
    private final ExecutorService executor;
    private final Cache<String, CachedEntries> cache;

    public FeedAggregator(AppConfig.FeedConfig config, FeedClient client) {
        this(config, client, Executors.newFixedThreadPool(Math.max(1, config.getFetchParallelism()), daemonThreads()));
    }

    FeedAggregator(AppConfig.FeedConfig config, FeedClient client, ExecutorService executor) {
        this.config = config;
        this.client = client;
        this.executor = executor;
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, config.getMaxCachedSources()))
                .expireAfterWrite(freshness())
                .build();
    }

    public Map<FeedSource, FeedFetchResult> fetch(List<FeedSource> sources, Instant now) {
        List<FeedSource> selected = selectWithinTierCaps(sources);
        Map<FeedSource, FeedFetchResult> results = new LinkedHashMap<>();
        Map<FeedSource, Future<List<FeedEntry>>> pending = new LinkedHashMap<>();

        for (FeedSource source : selected) {
            CachedEntries cached = cache.getIfPresent(source.url());
            if (cached != null && isFresh(cached, now)) {
                results.put(source, FeedFetchResult.success(source, materialise(source, cached), true));
                continue;
            }
            results.put(source, null);
            pending.put(source, executor.submit(() -> client.fetch(source)));
        }

        long timeoutMs = Math.max(1, config.getFetchTimeoutMs());
        for (Map.Entry<FeedSource, Future<List<FeedEntry>>> entry : pending.entrySet()) {
            FeedSource source = entry.getKey();
            results.put(source, await(source, entry.getValue(), timeoutMs, now));
        }

        int failures = (int) results.values().stream().filter(result -> !result.isSuccess()).count();
        int cacheHits = (int) results.values().stream().filter(FeedFetchResult::fromCache).count();
        log.info("feeds.cycle selected={} fetched={} cacheHits={} failures={}",
                selected.size(), pending.size(), cacheHits, failures);
        return results;
    }

    /**
     * Keeps sources in registry order, admitting at most the configured cap per tier.
     */
    List<FeedSource> selectWithinTierCaps(List<FeedSource> sources) {
        Map<Integer, Integer> admitted = new HashMap<>();
        List<FeedSource> selected = new ArrayList<>();
        for (FeedSource source : sources) {
            int used = admitted.getOrDefault(source.tier(), 0);
            if (used < config.capForTier(source.tier())) {
                admitted.put(source.tier(), used + 1);
                selected.add(source);
            }
        }
        return selected;
    }

    private FeedFetchResult await(FeedSource source, Future<List<FeedEntry>> future, long timeoutMs, Instant now) {
        try {
            List<FeedEntry> entries = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            List<FeedEntry> limited = entries.subList(0, Math.min(entries.size(), Math.max(0, config.getMaxItemsPerSource())));
            CachedEntries fresh = new CachedEntries(List.copyOf(limited), now);
            cache.put(source.url(), fresh);
            log.debug("feeds.fetch source={} entries={}", source.name(), limited.size());
            return FeedFetchResult.success(source, materialise(source, fresh), false);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("feeds.fetch.timeout source={} timeoutMs={}", source.name(), timeoutMs);
            return FeedFetchResult.failure(source, "timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("feeds.fetch.failed source={} reason={}", source.name(), cause.getMessage());
            return FeedFetchResult.failure(source, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return FeedFetchResult.failure(source, "interrupted");
        }
    }

    private List<FeedItem> materialise(FeedSource source, CachedEntries cached) {
        double weight = config.getCategoryWeights().getOrDefault(source.category().tag(), UNKNOWN_CATEGORY_WEIGHT);
        List<FeedItem> items = new ArrayList<>(cached.entries().size());
        for (FeedEntry entry : cached.entries()) {
            items.add(new FeedItem(
                    source,
                    entry.title(),
                    entry.summary(),
                    entry.link(),
                    entry.publishedAt(),
                    cached.fetchedAt(),
                    weight,
                    SeoTopic.classify(entry.title() + " " + entry.summary())));
        }
        return items;
    }

    private boolean isFresh(CachedEntries cached, Instant now) {
        Duration age = Duration.between(cached.fetchedAt(), now);
        return !age.isNegative() && age.compareTo(freshness()) < 0;
    }

    private Duration freshness() {
        return Duration.ofMinutes(Math.max(1, config.getCacheFreshnessMinutes()));
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "feed-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record CachedEntries(List<FeedEntry> entries, Instant fetchedAt) {
    }
}
