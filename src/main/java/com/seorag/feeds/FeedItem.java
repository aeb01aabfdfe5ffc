package com.seorag.feeds;

import java.time.Instant;

public record FeedItem(
        FeedSource source,
        String title,
        String summary,
        String link,
        Instant publishedAt,
        Instant fetchedAt,
        double categoryWeight,
        SeoTopic topic) {

    public String text() {
        if (summary == null || summary.isBlank()) {
            return title;
        }
        return title + "\n" + summary;
    }
}
