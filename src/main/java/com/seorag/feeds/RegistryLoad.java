package com.seorag.feeds;

import java.util.List;

public record RegistryLoad(List<FeedSource> sources, List<FeedSourceValidationError> validationErrors, boolean usedDefaults) {
    public RegistryLoad {
        sources = List.copyOf(sources);
        validationErrors = List.copyOf(validationErrors);
    }
}
