package com.seorag.index;

/**
 * Raised when the index is queried before a build or load has completed. Callers may retry later.
 */
public class IndexUnavailableException extends IllegalStateException {
    public IndexUnavailableException(String message) {
        super(message);
    }
}
