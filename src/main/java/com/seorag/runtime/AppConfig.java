package com.seorag.runtime;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IndexConfig index = new IndexConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private FeedConfig feeds = new FeedConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private ProviderConfig provider = new ProviderConfig();
    private TopicConfig topic = new TopicConfig();

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index == null ? new IndexConfig() : index;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public FeedConfig getFeeds() {
        return feeds;
    }

    public void setFeeds(FeedConfig feeds) {
        this.feeds = feeds == null ? new FeedConfig() : feeds;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public ProviderConfig getProvider() {
        return provider;
    }

    public void setProvider(ProviderConfig provider) {
        this.provider = provider == null ? new ProviderConfig() : provider;
    }

    public TopicConfig getTopic() {
        return topic;
    }

    public void setTopic(TopicConfig topic) {
        this.topic = topic == null ? new TopicConfig() : topic;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexConfig {
        private String indexDir = ".seorag/index";
        private String corpusDir = "data/corpus";
        private String formatVersion = "2.0";
        private boolean allowEmptyCorpus = false;
        private String smokeTestQuery = "SEO";

        public String getIndexDir() {
            return indexDir;
        }

        public void setIndexDir(String indexDir) {
            this.indexDir = indexDir;
        }

        public String getCorpusDir() {
            return corpusDir;
        }

        public void setCorpusDir(String corpusDir) {
            this.corpusDir = corpusDir;
        }

        public String getFormatVersion() {
            return formatVersion;
        }

        public void setFormatVersion(String formatVersion) {
            this.formatVersion = formatVersion;
        }

        public boolean isAllowEmptyCorpus() {
            return allowEmptyCorpus;
        }

        public void setAllowEmptyCorpus(boolean allowEmptyCorpus) {
            this.allowEmptyCorpus = allowEmptyCorpus;
        }

        public String getSmokeTestQuery() {
            return smokeTestQuery;
        }

        public void setSmokeTestQuery(String smokeTestQuery) {
            this.smokeTestQuery = smokeTestQuery;
        }
    }

    /**
     * Chunking and embedding batch policy. Sizes are in characters.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private int chunkSize = 500;
        private int chunkOverlap = 100;
        private int largeCorpusChunkSize = 300;
        private long largeCorpusThresholdChars = 800_000L;
        private int batchSize = 50;
        private int maxAttempts = 3;
        private long retryBackoffMs = 1000;

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public int getLargeCorpusChunkSize() {
            return largeCorpusChunkSize;
        }

        public void setLargeCorpusChunkSize(int largeCorpusChunkSize) {
            this.largeCorpusChunkSize = largeCorpusChunkSize;
        }

        public long getLargeCorpusThresholdChars() {
            return largeCorpusThresholdChars;
        }

        public void setLargeCorpusThresholdChars(long largeCorpusThresholdChars) {
            this.largeCorpusThresholdChars = largeCorpusThresholdChars;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeedConfig {
        private String sourcesFile = "data/feeds/feed_sources.csv";
        private Map<Integer, Integer> tierCaps = defaultTierCaps();
        private Map<String, Double> categoryWeights = defaultCategoryWeights();
        private long fetchTimeoutMs = 10_000;
        private long cacheFreshnessMinutes = 24 * 60;
        private int maxCachedSources = 100;
        private int maxItemsPerSource = 5;
        private int fetchParallelism = 8;
        private String userAgent = "SEO-RAG-FeedBot/1.0";
        private List<String> defaultFeeds = List.of(
                "https://status.search.google.com/feed",
                "https://developers.google.com/search/blog/feeds/blog-posts.xml",
                "https://searchengineland.com/feed",
                "https://www.seroundtable.com/index.xml");

        public String getSourcesFile() {
            return sourcesFile;
        }

        public void setSourcesFile(String sourcesFile) {
            this.sourcesFile = sourcesFile;
        }

        public Map<Integer, Integer> getTierCaps() {
            return tierCaps;
        }

        public void setTierCaps(Map<Integer, Integer> tierCaps) {
            this.tierCaps = tierCaps == null ? defaultTierCaps() : tierCaps;
        }

        public int capForTier(int tier) {
            return tierCaps.getOrDefault(tier, 0);
        }

        public Map<String, Double> getCategoryWeights() {
            return categoryWeights;
        }

        public void setCategoryWeights(Map<String, Double> categoryWeights) {
            this.categoryWeights = categoryWeights == null ? defaultCategoryWeights() : categoryWeights;
        }

        public long getFetchTimeoutMs() {
            return fetchTimeoutMs;
        }

        public void setFetchTimeoutMs(long fetchTimeoutMs) {
            this.fetchTimeoutMs = fetchTimeoutMs;
        }

        public long getCacheFreshnessMinutes() {
            return cacheFreshnessMinutes;
        }

        public void setCacheFreshnessMinutes(long cacheFreshnessMinutes) {
            this.cacheFreshnessMinutes = cacheFreshnessMinutes;
        }

        public int getMaxCachedSources() {
            return maxCachedSources;
        }

        public void setMaxCachedSources(int maxCachedSources) {
            this.maxCachedSources = maxCachedSources;
        }

        public int getMaxItemsPerSource() {
            return maxItemsPerSource;
        }

        public void setMaxItemsPerSource(int maxItemsPerSource) {
            this.maxItemsPerSource = maxItemsPerSource;
        }

        public int getFetchParallelism() {
            return fetchParallelism;
        }

        public void setFetchParallelism(int fetchParallelism) {
            this.fetchParallelism = fetchParallelism;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public List<String> getDefaultFeeds() {
            return defaultFeeds;
        }

        public void setDefaultFeeds(List<String> defaultFeeds) {
            this.defaultFeeds = defaultFeeds == null ? List.of() : defaultFeeds;
        }

        private static Map<Integer, Integer> defaultTierCaps() {
            Map<Integer, Integer> caps = new HashMap<>();
            caps.put(1, 5);
            caps.put(2, 10);
            caps.put(3, 5);
            return caps;
        }

        private static Map<String, Double> defaultCategoryWeights() {
            Map<String, Double> weights = new HashMap<>();
            weights.put("official", 1.0);
            weights.put("expert", 0.9);
            weights.put("media", 0.8);
            weights.put("tool_vendor", 0.7);
            return weights;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int defaultTopK = 8;
        private double recencyHalfLifeHours = 48.0;
        private double undatedRecency = 0.1;
        private double minSimilarity = 0.2;
        private FeedRelevanceConfig feedRelevance = new FeedRelevanceConfig();

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public double getRecencyHalfLifeHours() {
            return recencyHalfLifeHours;
        }

        public void setRecencyHalfLifeHours(double recencyHalfLifeHours) {
            this.recencyHalfLifeHours = recencyHalfLifeHours;
        }

        public double getUndatedRecency() {
            return undatedRecency;
        }

        public void setUndatedRecency(double undatedRecency) {
            this.undatedRecency = undatedRecency;
        }

        /** Static chunks scoring below this cosine similarity are not evidence. */
        public double getMinSimilarity() {
            return minSimilarity;
        }

        public void setMinSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
        }

        public FeedRelevanceConfig getFeedRelevance() {
            return feedRelevance;
        }

        public void setFeedRelevance(FeedRelevanceConfig feedRelevance) {
            this.feedRelevance = feedRelevance == null ? new FeedRelevanceConfig() : feedRelevance;
        }
    }

    /**
     * Term lists deciding whether a feed article is about search at all. Force-include terms win
     * over exclude terms.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeedRelevanceConfig {
        private List<String> primaryTerms = List.of(
                "seo", "search engine optimization", "検索エンジン最適化", "google", "bing", "yahoo",
                "search engine", "検索エンジン", "algorithm", "アルゴリズム", "ranking", "ランキング",
                "index", "インデックス", "crawl", "クロール", "keyword", "キーワード", "meta tag", "メタタグ",
                "google ai", "helpful content", "ヘルプフルコンテンツ", "product reviews", "page experience",
                "search generative experience", "sge", "generative ai", "gemini");
        private List<String> secondaryTerms = List.of(
                "website", "web site", "サイト", "page", "ページ", "content", "コンテンツ", "link", "リンク",
                "domain", "ドメイン", "organic", "オーガニック", "update", "アップデート", "penalty", "ペナルティ",
                "rolling out", "rollout", "展開", "feature", "機能", "labs", "experimental");
        private List<String> excludeTerms = List.of(
                "recipe", "cooking", "travel", "movie", "sports", "stock price", "real estate",
                "プログラミング言語", "データベース", "サーバー管理", "料理", "レシピ", "旅行", "映画",
                "ゲーム", "スポーツ", "医療", "健康", "金融", "投資", "株価", "不動産");
        private List<String> forceIncludeTerms = List.of(
                "ai mode", "ai overviews", "core update", "spam update", "コア更新", "スパム更新");

        public List<String> getPrimaryTerms() {
            return primaryTerms;
        }

        public void setPrimaryTerms(List<String> primaryTerms) {
            this.primaryTerms = primaryTerms == null ? List.of() : primaryTerms;
        }

        public List<String> getSecondaryTerms() {
            return secondaryTerms;
        }

        public void setSecondaryTerms(List<String> secondaryTerms) {
            this.secondaryTerms = secondaryTerms == null ? List.of() : secondaryTerms;
        }

        public List<String> getExcludeTerms() {
            return excludeTerms;
        }

        public void setExcludeTerms(List<String> excludeTerms) {
            this.excludeTerms = excludeTerms == null ? List.of() : excludeTerms;
        }

        public List<String> getForceIncludeTerms() {
            return forceIncludeTerms;
        }

        public void setForceIncludeTerms(List<String> forceIncludeTerms) {
            this.forceIncludeTerms = forceIncludeTerms == null ? List.of() : forceIncludeTerms;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TopicConfig {
        private List<String> essentialTerms = List.of(
                "seo", "search engine optimization", "検索エンジン最適化", "google", "bing", "yahoo",
                "search engine", "検索エンジン", "algorithm", "アルゴリズム", "ranking", "ランキング",
                "index", "indexing", "インデックス", "crawl", "crawler", "クロール", "keyword", "キーワード",
                "meta tag", "meta description", "メタタグ", "sitemap", "サイトマップ", "robots.txt", "robots",
                "noindex", "nofollow", "canonical", "hreflang", "redirect", "organic", "serp", "検索結果",
                "page speed", "core web vitals", "backlink", "link building", "alt text", "structured data",
                "構造化データ", "schema", "rich snippet", "featured snippet", "knowledge graph",
                "eeat", "e-e-a-t", "e-a-t", "ymyl", "local seo", "google business profile", "mobile first",
                "ai overviews", "ai overview", "ai mode", "core update", "spam update", "helpful content",
                "コア更新", "アップデート", "update", "search console", "サーチコンソール");
        private List<String> relatedTerms = List.of(
                "website", "web site", "ウェブサイト", "ホームページ", "content", "コンテンツ", "page", "ページ",
                "domain", "ドメイン", "url", "link", "リンク", "title tag", "h1", "penalty", "ペナルティ",
                "順位", "search", "検索", "optimization", "最適化", "webmaster", "analytics", "traffic",
                "トラフィック", "conversion", "ctr", "click through rate", "bounce rate", "user experience",
                "ux", "responsive", "mobile friendly", "duplicate");
        private List<String> excludeTerms = List.of(
                "recipe", "cooking", "baseball", "football", "movie", "python", "java", "javascript",
                "mysql", "postgresql", "stock price", "野球", "スポーツ", "料理", "レシピ", "旅行", "映画",
                "ゲーム", "医療", "健康", "金融", "投資", "株価", "不動産", "プログラミング言語",
                "データベース", "サーバー管理");

        public List<String> getEssentialTerms() {
            return essentialTerms;
        }

        public void setEssentialTerms(List<String> essentialTerms) {
            this.essentialTerms = essentialTerms == null ? List.of() : essentialTerms;
        }

        public List<String> getRelatedTerms() {
            return relatedTerms;
        }

        public void setRelatedTerms(List<String> relatedTerms) {
            this.relatedTerms = relatedTerms == null ? List.of() : relatedTerms;
        }

        public List<String> getExcludeTerms() {
            return excludeTerms;
        }

        public void setExcludeTerms(List<String> excludeTerms) {
            this.excludeTerms = excludeTerms == null ? List.of() : excludeTerms;
        }
    }

    /**
     * Model provider endpoints. A blank embedding URL selects the bundled local embedding model.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderConfig {
        private String embeddingUrl = "";
        private String embeddingModel = "text-embedding-3-small";
        private int localEmbeddingDimension = 384;
        private String completionUrl = "https://api.openai.com/v1/chat/completions";
        private String completionModel = "gpt-4o-mini";
        private double temperature = 0.5;
        private long timeoutMs = 60_000;
        private int completionMaxAttempts = 3;
        private long completionRetryBackoffMs = 500;

        public String getEmbeddingUrl() {
            return embeddingUrl;
        }

        public void setEmbeddingUrl(String embeddingUrl) {
            this.embeddingUrl = embeddingUrl;
        }

        public String getEmbeddingModel() {
            return embeddingModel;
        }

        public void setEmbeddingModel(String embeddingModel) {
            this.embeddingModel = embeddingModel;
        }

        public int getLocalEmbeddingDimension() {
            return localEmbeddingDimension;
        }

        public void setLocalEmbeddingDimension(int localEmbeddingDimension) {
            this.localEmbeddingDimension = localEmbeddingDimension;
        }

        public String getCompletionUrl() {
            return completionUrl;
        }

        public void setCompletionUrl(String completionUrl) {
            this.completionUrl = completionUrl;
        }

        public String getCompletionModel() {
            return completionModel;
        }

        public void setCompletionModel(String completionModel) {
            this.completionModel = completionModel;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getCompletionMaxAttempts() {
            return completionMaxAttempts;
        }

        public void setCompletionMaxAttempts(int completionMaxAttempts) {
            this.completionMaxAttempts = completionMaxAttempts;
        }

        public long getCompletionRetryBackoffMs() {
            return completionRetryBackoffMs;
        }

        public void setCompletionRetryBackoffMs(long completionRetryBackoffMs) {
            this.completionRetryBackoffMs = completionRetryBackoffMs;
        }
    }
}
