package com.seorag.runtime;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public record StartupEnvironment(String apiKey, boolean forceRebuild, Optional<String> tracingApiKey) {
    public static final String API_KEY = "SEORAG_API_KEY";
    public static final String FORCE_REBUILD = "FORCE_REBUILD_DB";
    public static final String TRACING_API_KEY = "SEORAG_TRACING_API_KEY";

    public static StartupEnvironment fromEnvironment() {
        return from(System.getenv());
    }

    public static StartupEnvironment from(Map<String, String> env) {
        String apiKey = env.get(API_KEY);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(API_KEY + " is not set; a model-provider credential is required");
        }
        boolean force = "true".equals(env.getOrDefault(FORCE_REBUILD, "false").strip().toLowerCase(Locale.ROOT));
        String tracing = env.get(TRACING_API_KEY);
        return new StartupEnvironment(
                apiKey.strip(),
                force,
                tracing == null || tracing.isBlank() ? Optional.empty() : Optional.of(tracing.strip()));
    }

    public boolean tracingEnabled() {
        return tracingApiKey.isPresent();
    }

    @Override
    public String toString() {
        return "StartupEnvironment{apiKey=***, forceRebuild=" + forceRebuild + ", tracingEnabled=" + tracingEnabled() + '}';
    }
}
