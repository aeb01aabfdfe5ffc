package com.seorag.feeds;

import java.util.List;
import java.util.Locale;

/**
 * Coarse topic tag for feed items. The first topic whose keywords appear in the text wins.
 */
public enum SeoTopic {
    ALGORITHM(List.of("core update", "spam update", "algorithm", "ranking", "update", "アップデート", "更新", "コア", "アルゴリズム", "ランキング")),
    TECHNICAL(List.of("crawl", "index", "page speed", "core web vitals", "mobile", "structured data", "schema", "クロール", "インデックス", "速度", "モバイル", "構造")),
    CONTENT(List.of("e-e-a-t", "e-a-t", "helpful content", "quality", "expertise", "authority", "trust", "品質", "専門性", "権威性", "信頼性")),
    SEARCH_FEATURES(List.of("ai overviews", "ai mode", "sge", "featured snippet", "voice search", "image search", "new feature", "音声検索", "画像検索", "新機能")),
    GENERAL(List.of());

    private final List<String> keywords;

    SeoTopic(List<String> keywords) {
        this.keywords = keywords;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SeoTopic classify(String text) {
        if (text == null || text.isBlank()) {
            return GENERAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (SeoTopic topic : values()) {
            for (String keyword : topic.keywords) {
                if (lower.contains(keyword)) {
                    return topic;
                }
            }
        }
        return GENERAL;
    }
}
