package com.seorag;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.seorag.feeds.FeedAggregator;
import com.seorag.feeds.FeedFetchResult;
import com.seorag.feeds.FeedItem;
import com.seorag.feeds.FeedSource;
import com.seorag.feeds.FeedSourceRegistry;
import com.seorag.feeds.HttpFeedClient;
import com.seorag.feeds.RegistryLoad;
import com.seorag.index.IndexHandle;
import com.seorag.index.PersistentIndexManager;
import com.seorag.inference.Answer;
import com.seorag.inference.AnswerService;
import com.seorag.inference.OpenAiCompletionService;
import com.seorag.ingest.BuildFailureException;
import com.seorag.ingest.CorpusLoader;
import com.seorag.ingest.EmbeddingService;
import com.seorag.ingest.EmbeddingServices;
import com.seorag.ingest.IngestionPipeline;
import com.seorag.retrieval.EvidenceUnit;
import com.seorag.retrieval.RetrievalFusionRanker;
import com.seorag.retrieval.RetrievalResult;
import com.seorag.routing.DomainRouter;
import com.seorag.routing.LexicalTopicClassifier;
import com.seorag.routing.Query;
import com.seorag.routing.SourceMix;
import com.seorag.runtime.AppConfig;
import com.seorag.runtime.ConfigurationException;
import com.seorag.runtime.StartupEnvironment;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

@Command(
        name = "seo-rag",
        mixinStandardHelpOptions = true,
        version = "seo-rag 0.1.0",
        description = "SEO knowledge base: persistent corpus index with live feed retrieval.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_BUILD_FAILED = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_RETRY_LATER = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file; the bundled application.yml is used when absent", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ensure-ready, retrieve, ask, chat, feeds", defaultValue = "ensure-ready", converter = ModeConverter.class)
    Mode mode;

    @Option(names = "--corpus-dir", description = "Directory of corpus documents (overrides index.corpusDir)")
    Path corpusDir;

    @Option(names = "--index-dir", description = "Directory holding the index marker and vector stores (overrides index.indexDir)")
    Path indexDir;

    @Option(names = "--feeds-file", description = "Feed source CSV (overrides feeds.sourcesFile)")
    Path feedsFile;

    @Option(names = "--query", description = "Query text used in retrieve and ask modes")
    String query;

    @Option(names = "--top-k", description = "Maximum evidence units to return; defaults to retrieval.defaultTopK")
    Integer topK;

    @Option(names = "--force-rebuild", description = "Rebuild the index even when a valid one exists", defaultValue = "false")
    boolean forceRebuild;

    @Option(names = "--route", description = "Override the router's source mix: ${COMPLETION-CANDIDATES}")
    SourceMix route;

    private final Map<String, String> environment;
    private final InputStream input;

    enum Mode {
        ENSURE_READY("ensure-ready"),
        RETRIEVE("retrieve"),
        ASK("ask"),
        CHAT("chat"),
        FEEDS("feeds");

        private final String label;

        Mode(String label) {
            this.label = label;
        }

        static Mode fromLabel(String value) {
            String normalized = value == null ? "" : value.strip().toLowerCase(Locale.ROOT).replace('_', '-');
            for (Mode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
            throw new CommandLine.TypeConversionException("Unknown mode '" + value + "'; expected ensure-ready, retrieve, ask, chat or feeds");
        }
    }

    static class ModeConverter implements ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            return Mode.fromLabel(value);
        }
    }

    public Main() {
        this(System.getenv(), System.in);
    }

    Main(Map<String, String> environment, InputStream input) {
        this.environment = environment;
        this.input = input;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        StartupEnvironment startup;
        AppConfig config;
        try {
            startup = StartupEnvironment.from(environment);
            config = loadConfig(configPath);
        } catch (ConfigurationException e) {
            log.error("startup.configuration-error reason={}", e.getMessage());
            return EXIT_CONFIGURATION;
        }

        log.info("Starting SEO knowledge base in {} mode", mode.label);
        log.info("Using config file: {}", Files.exists(configPath) ? configPath : "classpath:application.yml");
        if (startup.tracingEnabled()) {
            log.info("startup.tracing enabled=true");
        } else {
            log.info("startup.tracing enabled=false reason=\"{} not set\"", StartupEnvironment.TRACING_API_KEY);
        }

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getProvider().getTimeoutMs()))
                .build();
        EmbeddingService embeddingService = EmbeddingServices.fromConfig(config.getProvider(), startup.apiKey(), httpClient);
        AppConfig.FeedConfig feedConfig = config.getFeeds();
        Path sourcesFile = feedsFile != null ? feedsFile : Path.of(feedConfig.getSourcesFile());

        try (FeedAggregator aggregator = new FeedAggregator(feedConfig,
                new HttpFeedClient(httpClient, Duration.ofMillis(feedConfig.getFetchTimeoutMs()), feedConfig.getUserAgent()))) {
            RegistryLoad registry = new FeedSourceRegistry(sourcesFile, feedConfig.getDefaultFeeds()).load();
            List<FeedSource> sources = registry.sources();

            if (mode == Mode.FEEDS) {
                printFeeds(aggregator.fetch(sources, Instant.now()));
                return 0;
            }

            PersistentIndexManager indexManager = new PersistentIndexManager(
                    indexDir != null ? indexDir : Path.of(config.getIndex().getIndexDir()),
                    corpusDir != null ? corpusDir : Path.of(config.getIndex().getCorpusDir()),
                    config.getIndex(),
                    new CorpusLoader(),
                    new IngestionPipeline(config.getIngestion(), embeddingService),
                    embeddingService);
            try {
                IndexHandle handle = indexManager.ensureReady(forceRebuild || startup.forceRebuild());
                int smokeHits;
                try {
                    smokeHits = indexManager.smokeTest(config.getIndex().getSmokeTestQuery());
                } catch (IOException e) {
                    log.error("index.smoke-test.failed query=\"{}\" reason={}", config.getIndex().getSmokeTestQuery(), e.getMessage(), e);
                    return EXIT_RETRY_LATER;
                }
                log.info("index.ready version={} documents={} chunks={} smokeTest.query=\"{}\" smokeTest.results={}",
                        handle.version().versionToken(),
                        handle.version().documentCount(),
                        handle.version().chunkCount(),
                        config.getIndex().getSmokeTestQuery(),
                        smokeHits);
            } catch (BuildFailureException e) {
                log.error("index.build.failed reason={}", e.getMessage(), e);
                return EXIT_BUILD_FAILED;
            }

            DomainRouter router = new DomainRouter();
            RetrievalFusionRanker ranker = new RetrievalFusionRanker(
                    indexManager, embeddingService, aggregator, () -> sources, config.getRetrieval());
            int k = topK != null ? topK : config.getRetrieval().getDefaultTopK();

            if (mode == Mode.RETRIEVE) {
                if (query == null || query.isBlank()) {
                    log.error("--query is required in retrieve mode");
                    return EXIT_CONFIGURATION;
                }
                Query routed = route != null ? new Query(query, route) : router.route(query);
                printRetrieval(ranker.retrieve(routed, k));
            }
            if (mode == Mode.ASK) {
                if (query == null || query.isBlank()) {
                    log.error("--query is required in ask mode");
                    return EXIT_CONFIGURATION;
                }
                Answer answer = answerService(router, ranker, config, startup, httpClient).ask(query, k);
                printAnswer(answer);
                return answer.status().retryable() ? EXIT_RETRY_LATER : 0;
            }
            if (mode == Mode.CHAT) {
                runChat(answerService(router, ranker, config, startup, httpClient), k);
            }
        } catch (ConfigurationException e) {
            log.error("startup.configuration-error reason={}", e.getMessage());
            return EXIT_CONFIGURATION;
        }
        return 0;
    }

    static AppConfig loadConfig(Path config) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            if (Files.exists(config)) {
                return mapper.readValue(config.toFile(), AppConfig.class);
            }
            try (InputStream bundled = Main.class.getResourceAsStream("/application.yml")) {
                return bundled == null ? new AppConfig() : mapper.readValue(bundled, AppConfig.class);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration " + config + ": " + e.getMessage(), e);
        }
    }

    private static AnswerService answerService(
            DomainRouter router,
            RetrievalFusionRanker ranker,
            AppConfig config,
            StartupEnvironment startup,
            OkHttpClient httpClient) {
        AppConfig.ProviderConfig provider = config.getProvider();
        return new AnswerService(router, new LexicalTopicClassifier(config.getTopic()), ranker, new OpenAiCompletionService(
                httpClient,
                provider.getCompletionUrl(),
                provider.getCompletionModel(),
                provider.getTemperature(),
                startup.apiKey(),
                provider.getCompletionMaxAttempts(),
                provider.getCompletionRetryBackoffMs()));
    }

    private void runChat(AnswerService answerService, int k) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        List<EvidenceUnit> lastSources = List.of();
        System.out.println("SEO knowledge base ready. Type /help for commands.");
        while (true) {
            System.out.print("you> ");
            System.out.flush();
            String line = reader.readLine();
            if (line == null || "/exit".equals(line.strip()) || "/quit".equals(line.strip())) {
                break;
            }
            String question = line.strip();
            if (question.isEmpty()) {
                continue;
            }
            if ("/help".equals(question)) {
                System.out.println("Commands: /help, /source, /exit");
                continue;
            }
            if ("/source".equals(question)) {
                if (lastSources.isEmpty()) {
                    System.out.println("No sources from the current session yet.");
                } else {
                    for (int i = 0; i < lastSources.size(); i++) {
                        System.out.printf("[%d] %s %s%n", i + 1, lastSources.get(i).provenance(), lastSources.get(i).reference());
                    }
                }
                continue;
            }
            Answer answer = answerService.ask(question, k);
            lastSources = answer.evidence();
            printAnswer(answer);
        }
    }

    private static void printRetrieval(RetrievalResult result) {
        log.info("Retrieval label={} attempted={} results={} staticUnavailable={} feedFailures={}",
                result.label(), result.attempted(), result.evidence().size(), result.staticUnavailable(), result.feedFailures().keySet());
        if (result.isEmpty()) {
            System.out.println("No relevant material found.");
        }
        List<EvidenceUnit> evidence = result.evidence();
        for (int i = 0; i < evidence.size(); i++) {
            EvidenceUnit unit = evidence.get(i);
            System.out.printf(Locale.ROOT, "#%d [%s] score=%.4f raw=%.4f %s%n",
                    i + 1, unit.provenance(), unit.score(), unit.rawScore(), unit.reference());
        }
    }

    private static void printAnswer(Answer answer) {
        System.out.println("assistant> " + answer.text());
        if (!answer.evidence().isEmpty()) {
            System.out.println("sources:");
            for (EvidenceUnit unit : answer.evidence()) {
                System.out.println("  - [" + unit.provenance() + "] " + unit.reference());
            }
        }
    }

    private static void printFeeds(Map<FeedSource, FeedFetchResult> results) {
        for (FeedFetchResult result : results.values()) {
            if (!result.isSuccess()) {
                System.out.printf("%s (tier %d): FAILED %s%n", result.source().name(), result.source().tier(), result.failureReason());
                continue;
            }
            System.out.printf("%s (tier %d, %s)%s%n",
                    result.source().name(), result.source().tier(), result.source().category().tag(), result.fromCache() ? " [cached]" : "");
            for (FeedItem item : result.items()) {
                System.out.printf("  - [%s] %s %s%n", item.topic().tag(), item.title(), item.link());
            }
        }
    }
}
