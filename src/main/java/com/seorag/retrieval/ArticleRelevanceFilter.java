package com.seorag.retrieval;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.seorag.feeds.FeedItem;
import com.seorag.routing.KeywordMatcher;
import com.seorag.runtime.AppConfig;

/**
 * Keeps feed articles that are about search. Tracked Google changes are always kept; otherwise an
 * exclude term drops the article, one primary term keeps it, and two secondary terms keep it
 * when the article also shares a word with the question.
 */
public class ArticleRelevanceFilter {
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)20\\d{2}(?!\\d)");
    private static final List<String> YEAR_COMPANIONS = List.of("google", "update", "algorithm");

    private final List<String> primaryTerms;
    private final List<String> secondaryTerms;
    private final List<String> excludeTerms;
    private final List<String> forceIncludeTerms;

    public ArticleRelevanceFilter(AppConfig.FeedRelevanceConfig config) {
        this.primaryTerms = lowerCase(config.getPrimaryTerms());
        this.secondaryTerms = lowerCase(config.getSecondaryTerms());
        this.excludeTerms = lowerCase(config.getExcludeTerms());
        this.forceIncludeTerms = lowerCase(config.getForceIncludeTerms());
    }

    public boolean isRelevant(String query, FeedItem item) {
        return isRelevant(query, item.title(), item.summary());
    }

    public boolean isRelevant(String query, String title, String summary) {
        String content = ((title == null ? "" : title) + " " + (summary == null ? "" : summary)).toLowerCase(Locale.ROOT);
        if (KeywordMatcher.countMatches(content, forceIncludeTerms) > 0) {
            return true;
        }
        if (KeywordMatcher.countMatches(content, excludeTerms) > 0) {
            return false;
        }
        if (KeywordMatcher.countMatches(content, primaryTerms) > 0) {
            return true;
        }
        if (KeywordMatcher.countMatches(content, secondaryTerms) >= 2 && sharesQueryWord(query, content)) {
            return true;
        }
        return YEAR.matcher(content).find() && KeywordMatcher.countMatches(content, YEAR_COMPANIONS) > 0;
    }

    private static boolean sharesQueryWord(String query, String content) {
        if (query == null) {
            return false;
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> word.length() > 2)
                .anyMatch(content::contains);
    }

    private static List<String> lowerCase(List<String> terms) {
        return terms.stream().map(term -> term.toLowerCase(Locale.ROOT)).toList();
    }
}
