package com.seorag.feeds;

public record FeedSourceValidationError(int line, String name, String reason) {
}
