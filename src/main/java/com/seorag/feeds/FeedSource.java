package com.seorag.feeds;

/**
 * One registry row. {@code tier} is 1 (official), 2 (specialist media) or 3 (tool vendors) and
 * drives per-tier polling caps; {@code category} drives the relevance weight of its items.
 */
public record FeedSource(
        String type,
        String name,
        String url,
        FetchMethod fetchMethod,
        String description,
        String usageConstraint,
        int tier,
        FeedCategory category,
        String language) {
}
