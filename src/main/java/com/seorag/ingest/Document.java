package com.seorag.ingest;

import java.nio.file.Path;
import java.util.List;

/**
 * One source file of the static corpus as plain-text segments. {@code id} is the corpus-relative path.
 */
public record Document(String id, List<String> segments, Path sourcePath) {
    public Document {
        segments = List.copyOf(segments);
    }

    public String text() {
        return String.join("\n\n", segments);
    }
}
