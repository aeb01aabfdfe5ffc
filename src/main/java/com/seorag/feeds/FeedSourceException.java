package com.seorag.feeds;

import java.io.IOException;

public class FeedSourceException extends IOException {
    private final String sourceName;

    public FeedSourceException(String sourceName, String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public FeedSourceException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }
}
