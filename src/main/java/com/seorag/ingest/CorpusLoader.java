package com.seorag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.seorag.runtime.ConfigurationException;

/**
 * Scans the corpus directory wholesale. Files are visited in corpus-relative path order so that
 * identical input always yields the same document sequence.
 */
public class CorpusLoader {
    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private final List<DocumentParser> parsers;

    public CorpusLoader() {
        this(defaultParsers());
    }

    public CorpusLoader(List<DocumentParser> parsers) {
        this.parsers = parsers;
    }

    public CorpusLoad load(Path corpusDir) {
        if (!Files.isDirectory(corpusDir) || !Files.isReadable(corpusDir)) {
            throw new ConfigurationException("Corpus directory is missing or unreadable: "
                    + corpusDir.toAbsolutePath().normalize());
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(corpusDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted(Comparator.comparing(path -> relativeId(corpusDir, path)))
                    .toList();
        } catch (IOException e) {
            throw new ConfigurationException("Unable to scan corpus directory " + corpusDir, e);
        }

        List<Document> documents = new ArrayList<>();
        List<DocumentLoadFailure> failures = new ArrayList<>();
        for (Path file : files) {
            String id = relativeId(corpusDir, file);
            try {
                parse(file, id).ifPresent(documents::add);
            } catch (IOException | RuntimeException e) {
                log.warn("corpus.document.skipped id={} reason={}", id, e.getMessage());
                failures.add(new DocumentLoadFailure(id, e.getMessage()));
            }
        }
        log.info("corpus.scan dir={} files={} documents={} failures={}",
                corpusDir, files.size(), documents.size(), failures.size());
        return new CorpusLoad(documents, failures);
    }

    private boolean isSupported(Path path) {
        return parsers.stream().anyMatch(parser -> parser.supports(path));
    }

    private Optional<Document> parse(Path path, String id) throws IOException {
        for (DocumentParser parser : parsers) {
            if (parser.supports(path)) {
                return parser.parse(path, id);
            }
        }
        return Optional.empty();
    }

    private static String relativeId(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static List<DocumentParser> defaultParsers() {
        return List.of(
                new PlainTextDocumentParser(List.of(".txt", ".md", ".markdown"), false),
                new PlainTextDocumentParser(List.of(".csv"), true));
    }

    public record CorpusLoad(List<Document> documents, List<DocumentLoadFailure> failures) {
    }

    public record DocumentLoadFailure(String documentId, String reason) {
    }
}
