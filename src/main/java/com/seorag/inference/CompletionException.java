package com.seorag.inference;

import java.io.IOException;

/**
 * The answer-generation model could not produce a completion. Transient from the caller's view.
 */
public class CompletionException extends IOException {
    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
