package com.seorag.feeds;

import java.util.Locale;
import java.util.Optional;

public enum FetchMethod {
    RSS,
    ATOM,
    HTML;

    static Optional<FetchMethod> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(RSS);
        }
        try {
            return Optional.of(valueOf(value.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
