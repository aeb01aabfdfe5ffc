package com.seorag.index;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads and commits the index version marker. A commit writes a sibling temp file and moves it over
 * the marker, so a reader sees either the previous marker or the new one.
 */
public class IndexVersionStore {
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public Optional<IndexVersion> read(Path markerPath) throws IOException {
        if (!Files.exists(markerPath) || Files.size(markerPath) == 0L) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(markerPath.toFile(), IndexVersion.class));
    }

    public void commit(Path markerPath, IndexVersion version) throws IOException {
        if (markerPath.getParent() != null) {
            Files.createDirectories(markerPath.getParent());
        }
        Path temp = markerPath.resolveSibling(markerPath.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), version);
        try {
            Files.move(temp, markerPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, markerPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
