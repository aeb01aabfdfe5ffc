package com.seorag.feeds;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns RSS 2.0, Atom and plain HTML pages into {@link FeedEntry} lists. RSS and Atom are detected
 * from the document itself, so a source declared as one and serving the other still parses.
 */
public class FeedParser {
    private static final Logger log = LoggerFactory.getLogger(FeedParser.class);
    static final int MAX_SUMMARY_CHARS = 500;
    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
            value -> OffsetDateTime.parse(value).toInstant(),
            Instant::parse);

    public List<FeedEntry> parse(FeedSource source, String body) throws FeedSourceException {
        if (body == null || body.isBlank()) {
            throw new FeedSourceException(source.name(), "empty response body");
        }
        if (source.fetchMethod() == FetchMethod.HTML) {
            return List.of(parseHtml(source, body));
        }
        Document xml = Jsoup.parse(body, source.url(), Parser.xmlParser());
        if (!xml.select("item").isEmpty()) {
            return parseRss(xml);
        }
        if (!xml.select("entry").isEmpty()) {
            return parseAtom(xml);
        }
        if (xml.selectFirst("rss, feed, channel") != null) {
            return List.of();
        }
        throw new FeedSourceException(source.name(), "response is neither RSS nor Atom");
    }

    private List<FeedEntry> parseRss(Document xml) {
        List<FeedEntry> entries = new ArrayList<>();
        for (Element item : xml.select("item")) {
            String title = childText(item, "title");
            String link = childText(item, "link");
            if (link.isEmpty()) {
                link = childText(item, "guid");
            }
            String summary = plainText(childText(item, "description"));
            Instant published = parseDate(childText(item, "pubDate"));
            if (published == null) {
                published = parseDate(childText(item, "dc|date"));
            }
            if (!title.isEmpty() || !summary.isEmpty()) {
                entries.add(new FeedEntry(title, summary, link, published));
            }
        }
        return entries;
    }

    private List<FeedEntry> parseAtom(Document xml) {
        List<FeedEntry> entries = new ArrayList<>();
        for (Element entry : xml.select("entry")) {
            String title = plainText(childText(entry, "title"));
            String summary = childText(entry, "summary");
            if (summary.isEmpty()) {
                summary = childText(entry, "content");
            }
            Element linkElement = entry.selectFirst("link[rel=alternate]");
            if (linkElement == null) {
                linkElement = entry.selectFirst("link");
            }
            String link = linkElement == null ? "" : linkElement.attr("href");
            Instant published = parseDate(childText(entry, "published"));
            if (published == null) {
                published = parseDate(childText(entry, "updated"));
            }
            if (!title.isEmpty() || !summary.isEmpty()) {
                entries.add(new FeedEntry(title, plainText(summary), link, published));
            }
        }
        return entries;
    }

    private FeedEntry parseHtml(FeedSource source, String body) {
        Document page = Jsoup.parse(body, source.url());
        String title = page.title().strip();
        if (title.isEmpty()) {
            title = source.name();
        }
        String summary = page.select("meta[name=description]").attr("content").strip();
        if (summary.isEmpty()) {
            summary = page.select("meta[property=og:description]").attr("content").strip();
        }
        if (summary.isEmpty()) {
            Element article = page.selectFirst("article");
            summary = article != null ? article.text() : page.select("p").text();
        }
        Instant published = parseDate(page.select("meta[property=article:published_time]").attr("content"));
        return new FeedEntry(title, truncate(summary.strip()), source.url(), published);
    }

    private static String childText(Element parent, String tag) {
        Element child = parent.selectFirst(tag);
        return child == null ? "" : child.text().strip();
    }

    private static String plainText(String maybeHtml) {
        if (maybeHtml.isEmpty()) {
            return maybeHtml;
        }
        return truncate(Jsoup.parse(maybeHtml).text().strip());
    }

    private static String truncate(String text) {
        return text.length() <= MAX_SUMMARY_CHARS ? text : text.substring(0, MAX_SUMMARY_CHARS);
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.strip();
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(trimmed);
            } catch (DateTimeParseException e) {
                log.trace("feeds.date.unparsed value={} reason={}", trimmed, e.getMessage());
            }
        }
        return null;
    }
}
