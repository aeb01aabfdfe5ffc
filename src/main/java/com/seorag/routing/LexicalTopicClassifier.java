package com.seorag.routing;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.seorag.runtime.AppConfig;

/**
 * Keyword gate for SEO questions.
 *
 * <p>An exclude term rejects the question outright. Otherwise one essential term, two related
 * terms, or one related term in a short question of at most three words is enough. A question
 * that asks to define an upper-case acronym ("What is SGE?", "FLUQsとは") is accepted as a
 * possible new search term when it is short or mentions the web.
 */
public class LexicalTopicClassifier implements TopicClassifier {
    private static final Pattern ACRONYM = Pattern.compile("(?<![A-Za-z])[A-Z]{2,}s?(?![A-Za-z])");
    private static final List<String> DEFINITION_MARKERS = List.of(
            "what is", "what does", "meaning of", "define", "とは", "って何", "の意味", "について", "を教えて");
    private static final List<String> WEB_CONTEXT_TERMS = List.of(
            "web", "digital", "online", "internet", "google", "search", "marketing", "seo", "sem",
            "advertising", "ウェブ", "デジタル", "オンライン", "検索", "マーケティング", "広告");

    private final List<String> essentialTerms;
    private final List<String> relatedTerms;
    private final List<String> excludeTerms;

    public LexicalTopicClassifier() {
        this(new AppConfig.TopicConfig());
    }

    public LexicalTopicClassifier(AppConfig.TopicConfig config) {
        this.essentialTerms = lowerCase(config.getEssentialTerms());
        this.relatedTerms = lowerCase(config.getRelatedTerms());
        this.excludeTerms = lowerCase(config.getExcludeTerms());
    }

    @Override
    public boolean isSeoRelated(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        String text = query.toLowerCase(Locale.ROOT);
        if (KeywordMatcher.countMatches(text, excludeTerms) > 0) {
            return false;
        }
        if (KeywordMatcher.countMatches(text, essentialTerms) > 0) {
            return true;
        }
        int related = KeywordMatcher.countMatches(text, relatedTerms);
        int words = query.trim().split("\\s+").length;
        if (related >= 2 || (related == 1 && words <= 3)) {
            return true;
        }
        return asksForNewAcronym(query, text, words);
    }

    private static boolean asksForNewAcronym(String query, String text, int words) {
        if (!ACRONYM.matcher(query).find() || !KeywordMatcher.containsAny(text, DEFINITION_MARKERS)) {
            return false;
        }
        return words <= 4 || KeywordMatcher.containsAny(text, WEB_CONTEXT_TERMS);
    }

    private static List<String> lowerCase(List<String> terms) {
        return terms.stream().map(term -> term.toLowerCase(Locale.ROOT)).toList();
    }
}
