package com.seorag.feeds;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FeedSourceRegistryTest {
    private static final List<String> DEFAULTS = List.of(
            "https://status.search.google.com/feed",
            "https://searchengineland.com/feed");

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadValidRowsAndSkipInvalidOnes() throws Exception {
        Path csv = tempDir.resolve("feeds.csv");
        Files.writeString(csv, """
                type,name,url,fetch_method,description,usage_constraint,tier,category,language
                official,Google Search Central,https://developers.google.com/search/blog/feeds/blog-posts.xml,ATOM,Official blog,attribution,1,official,en
                media,Search Engine Land,https://searchengineland.com/feed,RSS,News,summaries only,2,media,en
                media,Bad Tier,https://example.com/feed,RSS,News,,4,media,en
                media,Bad Url,ftp://example.com/feed,RSS,News,,2,media,en
                media,Bad Category,https://example.org/feed,RSS,News,,2,newspaper,en
                media,No Language,https://example.net/feed,RSS,News,,2,media,
                media,Duplicate,https://searchengineland.com/feed,RSS,News,,2,media,en
                tool_vendor,Ahrefs Blog,https://ahrefs.com/blog/feed/,,Research,,3,tool_vendor,en
                """);

        RegistryLoad load = new FeedSourceRegistry(csv, DEFAULTS).load();

        assertFalse(load.usedDefaults());
        assertEquals(List.of("Google Search Central", "Search Engine Land", "Ahrefs Blog", "Default Feed (status.search.google.com)"),
                load.sources().stream().map(FeedSource::name).toList());
        assertEquals(FetchMethod.ATOM, load.sources().get(0).fetchMethod());
        assertEquals(FetchMethod.RSS, load.sources().get(2).fetchMethod());
        assertEquals(FeedCategory.TOOL_VENDOR, load.sources().get(2).category());
        assertEquals(3, load.sources().get(2).tier());
        assertEquals(5, load.validationErrors().size());
        assertEquals(4, load.validationErrors().get(0).line());
        assertEquals("Bad Tier", load.validationErrors().get(0).name());
        assertTrue(load.validationErrors().get(4).reason().contains("duplicate"));
    }

    @Test
    void shouldAcceptColumnsInAnyOrder() throws Exception {
        Path csv = tempDir.resolve("feeds.csv");
        Files.writeString(csv, """
                language,category,tier,url,name
                ja,expert,2,https://www.suzukikenichi.com/blog/feeds/posts/default,SEO Japan
                """);

        RegistryLoad load = new FeedSourceRegistry(csv, DEFAULTS).load();

        assertEquals(3, load.sources().size());
        FeedSource source = load.sources().get(0);
        assertEquals("SEO Japan", source.name());
        assertEquals("ja", source.language());
        assertEquals(FeedCategory.EXPERT, source.category());
    }

    @Test
    void shouldAppendDefaultFeedsNotAlreadyListed() throws Exception {
        Path csv = tempDir.resolve("feeds.csv");
        Files.writeString(csv, """
                name,url,tier,category,language
                Search Engine Land,https://searchengineland.com/feed,1,media,en
                """);

        RegistryLoad load = new FeedSourceRegistry(csv, DEFAULTS).load();

        assertFalse(load.usedDefaults());
        assertEquals(List.of("https://searchengineland.com/feed", "https://status.search.google.com/feed"),
                load.sources().stream().map(FeedSource::url).toList());
        assertEquals(1, load.sources().get(0).tier());
        FeedSource appended = load.sources().get(1);
        assertEquals(2, appended.tier());
        assertEquals(FeedCategory.MEDIA, appended.category());
        assertTrue(load.validationErrors().isEmpty());
    }

    @Test
    void shouldFallBackToDefaultFeedsWhenFileIsMissing() {
        RegistryLoad load = new FeedSourceRegistry(tempDir.resolve("missing.csv"), DEFAULTS).load();

        assertTrue(load.usedDefaults());
        assertEquals(2, load.sources().size());
        for (FeedSource source : load.sources()) {
            assertEquals(2, source.tier());
            assertEquals(FeedCategory.MEDIA, source.category());
            assertEquals(FetchMethod.RSS, source.fetchMethod());
        }
    }

    @Test
    void shouldFallBackToDefaultFeedsWhenHeaderLacksRequiredColumns() throws Exception {
        Path csv = tempDir.resolve("feeds.csv");
        Files.writeString(csv, "site,address\nGoogle,https://example.com\n");

        RegistryLoad load = new FeedSourceRegistry(csv, DEFAULTS).load();

        assertTrue(load.usedDefaults());
        assertEquals(DEFAULTS, load.sources().stream().map(FeedSource::url).toList());
        assertEquals(1, load.validationErrors().size());
    }
}
