package com.seorag.index;

import java.time.Instant;

public record IndexVersion(
        String versionToken,
        Instant createdAt,
        String formatVersion,
        String embeddingVersion,
        int documentCount,
        int chunkCount) {
}
