package com.seorag.feeds;

import java.time.Instant;

/**
 * Entry as parsed from a feed document, before any source-specific weighting.
 * {@code publishedAt} is null when the feed carries no parseable date.
 */
public record FeedEntry(String title, String summary, String link, Instant publishedAt) {
}
