package com.seorag.routing;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword heuristic for deciding whether a query needs fresh information.
 *
 * <p>A query carries a recency signal when it names a tracked Google change (core update, AI
 * Overviews and similar), mentions a time marker such as a year or "this week", or combines a
 * general recency word with a search-engine or SEO term. News-style queries with no conceptual
 * framing go to the live feeds alone; other recency signals consult both sources.
 */
public class LexicalQueryClassifier implements QueryClassifier {
    static final List<String> HIGH_PRIORITY_TERMS = List.of(
            "ai mode", "ai overviews", "ai overview", "google ai", "gemini",
            "core update", "spam update", "helpful content", "product reviews update",
            "コア更新", "コアアップデート", "スパム更新", "ヘルプフルコンテンツ");
    static final List<String> GENERAL_RECENCY_TERMS = List.of(
            "update", "updates", "latest", "new", "recent", "recently", "current", "rollout", "announced", "release",
            "アップデート", "最新", "新機能", "発表", "リリース");
    static final List<String> TIME_MARKERS = List.of(
            "this week", "today", "yesterday", "this month", "last week", "right now",
            "今日", "今週", "今月", "今年");
    static final List<String> SEARCH_ENGINE_TERMS = List.of(
            "google", "bing", "search", "serp", "seo", "algorithm", "ranking", "rankings", "グーグル", "検索", "アルゴリズム");
    static final List<String> NEWS_MARKERS = List.of(
            "news", "breaking", "today", "this week", "ニュース", "速報");
    static final List<String> CONCEPTUAL_MARKERS = List.of(
            "how", "what is", "what are", "why", "guide", "best practice", "best practices", "explain",
            "difference", "tutorial", "checklist", "方法", "とは", "なぜ", "やり方");

    private static final Pattern YEAR = Pattern.compile("(?<!\\d)20\\d{2}(?!\\d)");
    // "status" and "outage" only count as news next to a search engine.
    private static final Pattern ENGINE_STATUS = Pattern.compile(
            "\\b(?:google|bing|search)(?: search)? (?:status|outage|down)\\b"
                    + "|\\b(?:status|outage)s? (?:of|for|on|at) (?:google|bing|search)\\b");

    @Override
    public RouteDecision classify(String query) {
        String text = query.toLowerCase(Locale.ROOT);

        String highPriority = firstMatch(text, HIGH_PRIORITY_TERMS);
        boolean timeMarker = firstMatch(text, TIME_MARKERS) != null || YEAR.matcher(text).find();
        boolean generalWithEngine = firstMatch(text, GENERAL_RECENCY_TERMS) != null
                && firstMatch(text, SEARCH_ENGINE_TERMS) != null;
        boolean recency = highPriority != null || timeMarker || generalWithEngine;
        String news = firstMatch(text, NEWS_MARKERS);
        if (news == null && ENGINE_STATUS.matcher(text).find()) {
            news = "search engine status";
        }
        String conceptual = firstMatch(text, CONCEPTUAL_MARKERS);

        if (news != null && conceptual == null) {
            return RouteDecision.of(SourceMix.LIVE, "news marker '" + news + "' without conceptual framing");
        }
        if (recency) {
            String signal = highPriority != null
                    ? "tracked change '" + highPriority + "'"
                    : timeMarker ? "time marker" : "recency term with search engine";
            return RouteDecision.of(SourceMix.BOTH, signal);
        }
        if (news != null) {
            return RouteDecision.ambiguous("news marker '" + news + "' with conceptual marker '" + conceptual + "'");
        }
        return RouteDecision.of(SourceMix.STATIC, "no recency signal");
    }

    private static String firstMatch(String text, List<String> terms) {
        return KeywordMatcher.firstMatch(text, terms);
    }
}
