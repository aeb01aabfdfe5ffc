package com.seorag.feeds;

import java.util.Locale;
import java.util.Optional;

public enum FeedCategory {
    OFFICIAL,
    EXPERT,
    MEDIA,
    TOOL_VENDOR;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FeedCategory> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.strip().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FeedCategory category : values()) {
            if (category.tag().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
