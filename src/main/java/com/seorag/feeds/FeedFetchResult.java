package com.seorag.feeds;

import java.util.List;

/**
 * Outcome of polling one source in a cycle. A failure carries the reason and no items.
 */
public record FeedFetchResult(FeedSource source, List<FeedItem> items, boolean fromCache, String failureReason) {
    public FeedFetchResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static FeedFetchResult success(FeedSource source, List<FeedItem> items, boolean fromCache) {
        return new FeedFetchResult(source, items, fromCache, null);
    }

    public static FeedFetchResult failure(FeedSource source, String reason) {
        return new FeedFetchResult(source, List.of(), false, reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
