package com.seorag.feeds;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

/**
 * Loads the curated feed list from CSV. The header row names the columns; column order is free.
 * The configured default URLs are appended after the CSV rows unless a row already uses them.
 * When the file is missing or cannot be parsed at all, the defaults are used alone.
 */
public class FeedSourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(FeedSourceRegistry.class);
    static final List<String> REQUIRED_COLUMNS = List.of("name", "url", "tier", "category", "language");

    private final Path csvFile;
    private final List<String> defaultFeeds;
    private final CsvMapper mapper;

    public FeedSourceRegistry(Path csvFile, List<String> defaultFeeds) {
        this.csvFile = csvFile;
        this.defaultFeeds = List.copyOf(defaultFeeds);
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public RegistryLoad load() {
        if (!Files.isRegularFile(csvFile)) {
            log.warn("feeds.registry.missing file={} fallback=defaultFeeds count={}", csvFile, defaultFeeds.size());
            return defaults(List.of());
        }
        List<List<String>> rows;
        try (MappingIterator<List<String>> iterator = mapper.readerForListOf(String.class).readValues(csvFile.toFile())) {
            rows = iterator.readAll();
        } catch (IOException | RuntimeJsonMappingException e) {
            log.warn("feeds.registry.unparseable file={} reason={} fallback=defaultFeeds", csvFile, e.getMessage());
            return defaults(List.of());
        }
        if (rows.isEmpty()) {
            log.warn("feeds.registry.empty file={} fallback=defaultFeeds", csvFile);
            return defaults(List.of());
        }

        Map<String, Integer> columns = headerIndex(rows.get(0));
        List<String> missing = REQUIRED_COLUMNS.stream().filter(column -> !columns.containsKey(column)).toList();
        if (!missing.isEmpty()) {
            log.warn("feeds.registry.header-invalid file={} missingColumns={} fallback=defaultFeeds", csvFile, missing);
            return defaults(List.of(new FeedSourceValidationError(1, "", "missing columns " + missing)));
        }

        List<FeedSource> sources = new ArrayList<>();
        List<FeedSourceValidationError> errors = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        for (int i = 1; i < rows.size(); i++) {
            int line = i + 1;
            Row row = new Row(rows.get(i), columns);
            String name = row.get("name");
            Optional<String> problem = validate(row);
            if (problem.isPresent()) {
                errors.add(new FeedSourceValidationError(line, name, problem.get()));
                continue;
            }
            String url = row.get("url");
            if (!seenUrls.add(url)) {
                errors.add(new FeedSourceValidationError(line, name, "duplicate url " + url));
                continue;
            }
            sources.add(new FeedSource(
                    row.get("type"),
                    name,
                    url,
                    FetchMethod.parse(row.get("fetch_method")).orElseThrow(),
                    row.get("description"),
                    row.get("usage_constraint"),
                    Integer.parseInt(row.get("tier")),
                    FeedCategory.fromTag(row.get("category")).orElseThrow(),
                    row.get("language")));
        }

        List<FeedSource> merged = defaultSources(seenUrls);
        sources.addAll(merged);

        for (FeedSourceValidationError error : errors) {
            log.warn("feeds.registry.invalid-row line={} name={} reason={}", error.line(), error.name(), error.reason());
        }
        log.info("feeds.registry.loaded file={} sources={} defaultsAdded={} rejected={}",
                csvFile, sources.size(), merged.size(), errors.size());
        return new RegistryLoad(sources, errors, false);
    }

    private static Optional<String> validate(Row row) {
        if (row.get("name").isEmpty()) {
            return Optional.of("name is required");
        }
        String url = row.get("url");
        if (!isHttpUrl(url)) {
            return Optional.of("url must be an absolute http(s) URL: '" + url + "'");
        }
        String tier = row.get("tier");
        try {
            int value = Integer.parseInt(tier);
            if (value < 1 || value > 3) {
                return Optional.of("tier must be 1, 2 or 3: " + tier);
            }
        } catch (NumberFormatException e) {
            return Optional.of("tier is not a number: '" + tier + "'");
        }
        if (FeedCategory.fromTag(row.get("category")).isEmpty()) {
            return Optional.of("unknown category '" + row.get("category") + "'");
        }
        if (row.get("language").isEmpty()) {
            return Optional.of("language is required");
        }
        if (FetchMethod.parse(row.get("fetch_method")).isEmpty()) {
            return Optional.of("unknown fetch_method '" + row.get("fetch_method") + "'");
        }
        return Optional.empty();
    }

    private static boolean isHttpUrl(String value) {
        if (value.isEmpty()) {
            return false;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            return (scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private RegistryLoad defaults(List<FeedSourceValidationError> errors) {
        return new RegistryLoad(defaultSources(new HashSet<>()), errors, true);
    }

    private List<FeedSource> defaultSources(Set<String> seen) {
        List<FeedSource> sources = new ArrayList<>();
        for (String url : defaultFeeds) {
            if (!isHttpUrl(url) || !seen.add(url)) {
                continue;
            }
            sources.add(new FeedSource(
                    "rss",
                    "Default Feed (" + URI.create(url).getHost() + ")",
                    url,
                    FetchMethod.RSS,
                    "Fallback feed",
                    "",
                    2,
                    FeedCategory.MEDIA,
                    "en"));
        }
        return sources;
    }

    private static Map<String, Integer> headerIndex(List<String> header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String column = header.get(i) == null ? "" : header.get(i).strip().toLowerCase(Locale.ROOT);
            if (i == 0 && column.startsWith("\uFEFF")) {
                column = column.substring(1);
            }
            index.putIfAbsent(column, i);
        }
        return index;
    }

    private record Row(List<String> values, Map<String, Integer> columns) {
        String get(String column) {
            Integer index = columns.get(column);
            if (index == null || index >= values.size() || values.get(index) == null) {
                return "";
            }
            return values.get(index).strip();
        }
    }
}
