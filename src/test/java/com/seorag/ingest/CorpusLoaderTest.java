package com.seorag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.seorag.runtime.ConfigurationException;

class CorpusLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadSupportedFilesInRelativePathOrder() throws Exception {
        Files.createDirectories(tempDir.resolve("guides"));
        Files.writeString(tempDir.resolve("b-links.md"), "Internal links.");
        Files.writeString(tempDir.resolve("a-titles.txt"), "Title tags.");
        Files.writeString(tempDir.resolve("guides/eeat.markdown"), "Experience and expertise.");
        Files.writeString(tempDir.resolve("keywords.csv"), "keyword,volume\nseo,100\n\nsem,50\n");
        Files.writeString(tempDir.resolve("slides.pdf"), "binary");

        CorpusLoader.CorpusLoad load = new CorpusLoader().load(tempDir);

        List<String> ids = load.documents().stream().map(Document::id).toList();
        assertEquals(List.of("a-titles.txt", "b-links.md", "guides/eeat.markdown", "keywords.csv"), ids);
        assertEquals(List.of("keyword,volume", "seo,100", "sem,50"), load.documents().get(3).segments());
        assertTrue(load.failures().isEmpty());
    }

    @Test
    void shouldReportEmptyCorpusWithoutFailing() {
        CorpusLoader.CorpusLoad load = new CorpusLoader().load(tempDir);

        assertTrue(load.documents().isEmpty());
    }

    @Test
    void shouldRecordPerDocumentFailuresAndContinue() throws Exception {
        Files.writeString(tempDir.resolve("good.md"), "Readable.");
        Files.writeString(tempDir.resolve("bad.md"), "Unreadable.");
        DocumentParser failing = new DocumentParser() {
            private final PlainTextDocumentParser delegate = new PlainTextDocumentParser(List.of(".md"), false);

            @Override
            public boolean supports(Path path) {
                return delegate.supports(path);
            }

            @Override
            public Optional<Document> parse(Path path, String documentId) throws IOException {
                if (documentId.startsWith("bad")) {
                    throw new IOException("corrupt file");
                }
                return delegate.parse(path, documentId);
            }
        };

        CorpusLoader.CorpusLoad load = new CorpusLoader(List.of(failing)).load(tempDir);

        assertEquals(1, load.documents().size());
        assertEquals("bad.md", load.failures().get(0).documentId());
    }

    @Test
    void shouldRejectMissingCorpusDirectory() {
        assertThrows(ConfigurationException.class, () -> new CorpusLoader().load(tempDir.resolve("missing")));
    }
}
