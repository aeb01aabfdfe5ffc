package com.seorag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class PlainTextDocumentParser implements DocumentParser {
    private final List<String> extensions;
    private final boolean rowPerSegment;

    public PlainTextDocumentParser(List<String> extensions, boolean rowPerSegment) {
        this.extensions = extensions;
        this.rowPerSegment = rowPerSegment;
    }

    @Override
    public boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    @Override
    public Optional<Document> parse(Path path, String documentId) throws IOException {
        if (!supports(path)) {
            return Optional.empty();
        }
        String content = Normalizer.normalize(Files.readString(path, StandardCharsets.UTF_8), Normalizer.Form.NFC);
        List<String> segments = rowPerSegment
                ? content.lines().map(String::strip).filter(line -> !line.isEmpty()).toList()
                : List.of(content.strip());
        return Optional.of(new Document(documentId, segments, path));
    }
}
