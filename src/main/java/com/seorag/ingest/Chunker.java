package com.seorag.ingest;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs blank-line separated paragraphs into chunks of at most {@code chunkSize} characters.
 * Paragraphs longer than a chunk are cut into overlapping windows. Chunks never cross documents.
 */
public class Chunker {
    private final int chunkSize;
    private final int overlap;

    public Chunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be >= 0 and < chunkSize");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<DocumentChunk> chunk(Document document) {
        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String paragraph : document.text().split("\\R\\s*\\R")) {
            String trimmed = paragraph.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.length() > chunkSize) {
                flush(current, pieces);
                int step = chunkSize - overlap;
                for (int start = 0; ; start += step) {
                    int end = Math.min(trimmed.length(), start + chunkSize);
                    pieces.add(trimmed.substring(start, end));
                    if (end == trimmed.length()) {
                        break;
                    }
                }
            } else if (current.length() == 0) {
                current.append(trimmed);
            } else if (current.length() + 2 + trimmed.length() <= chunkSize) {
                current.append("\n\n").append(trimmed);
            } else {
                flush(current, pieces);
                current.append(trimmed);
            }
        }
        flush(current, pieces);

        List<DocumentChunk> chunks = new ArrayList<>(pieces.size());
        for (int ordinal = 0; ordinal < pieces.size(); ordinal++) {
            String text = pieces.get(ordinal);
            ChunkMetadata metadata = new ChunkMetadata(
                    document.id(),
                    document.sourcePath() == null ? document.id() : document.sourcePath().toString(),
                    ordinal,
                    text.length());
            chunks.add(new DocumentChunk(document.id() + "#" + ordinal, text, metadata));
        }
        return chunks;
    }

    public int chunkSize() {
        return chunkSize;
    }

    private static void flush(StringBuilder current, List<String> pieces) {
        if (current.length() > 0) {
            pieces.add(current.toString());
            current.setLength(0);
        }
    }
}
