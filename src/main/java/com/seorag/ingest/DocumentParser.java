package com.seorag.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Turns one corpus file into plain-text segments. Binary formats are handled by an external
 * extraction step that drops its text output into the corpus directory.
 */
public interface DocumentParser {
    boolean supports(Path path);

    Optional<Document> parse(Path path, String documentId) throws IOException;
}
