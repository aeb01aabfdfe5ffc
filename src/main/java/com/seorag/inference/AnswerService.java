package com.seorag.inference;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.seorag.index.IndexUnavailableException;
import com.seorag.retrieval.RetrievalFusionRanker;
import com.seorag.retrieval.RetrievalResult;
import com.seorag.routing.DomainRouter;
import com.seorag.routing.LexicalTopicClassifier;
import com.seorag.routing.Query;
import com.seorag.routing.TopicClassifier;

/**
 * Declines questions outside SEO, then routes, retrieves evidence and asks the completion model
 * for a grounded answer. Each outcome maps to one {@link AnswerStatus} so callers can tell "try
 * again" apart from "nothing relevant".
 */
public class AnswerService {
    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);
    static final String NO_EVIDENCE_MESSAGE = "No relevant material was found for this question.";
    static final String INDEX_NOT_READY_MESSAGE = "The knowledge base is still being prepared. Please try again shortly.";
    static final String OFF_TOPIC_MESSAGE = "This is an SEO-only assistant. Please ask about search engine optimisation,"
            + " for example algorithm updates, keyword research, page speed or meta tags.";
    static final String UPSTREAM_ERROR_MESSAGE = "The answer service is temporarily unavailable. Please try again.";

    private final DomainRouter router;
    private final TopicClassifier topicClassifier;
    private final RetrievalFusionRanker ranker;
    private final CompletionService completionService;
    private final PromptBuilder promptBuilder;

    public AnswerService(DomainRouter router, RetrievalFusionRanker ranker, CompletionService completionService) {
        this(router, new LexicalTopicClassifier(), ranker, completionService);
    }

    public AnswerService(
            DomainRouter router,
            TopicClassifier topicClassifier,
            RetrievalFusionRanker ranker,
            CompletionService completionService) {
        this(router, topicClassifier, ranker, completionService, new PromptBuilder());
    }

    AnswerService(
            DomainRouter router,
            TopicClassifier topicClassifier,
            RetrievalFusionRanker ranker,
            CompletionService completionService,
            PromptBuilder promptBuilder) {
        this.router = router;
        this.topicClassifier = topicClassifier;
        this.ranker = ranker;
        this.completionService = completionService;
        this.promptBuilder = promptBuilder;
    }

    public Answer ask(String question, int k) {
        if (!topicClassifier.isSeoRelated(question)) {
            log.info("answer.off-topic query=\"{}\"", question == null ? "" : abbreviate(question));
            return new Answer(AnswerStatus.OFF_TOPIC, OFF_TOPIC_MESSAGE, List.of());
        }
        Query query = router.route(question);
        RetrievalResult result;
        try {
            result = ranker.retrieve(query, k);
        } catch (IndexUnavailableException e) {
            log.warn("answer.index-not-ready reason={}", e.getMessage());
            return new Answer(AnswerStatus.INDEX_NOT_READY, INDEX_NOT_READY_MESSAGE, List.of());
        } catch (IOException e) {
            log.warn("answer.retrieval.failed reason={}", e.getMessage());
            return new Answer(AnswerStatus.UPSTREAM_ERROR, UPSTREAM_ERROR_MESSAGE, List.of());
        }

        if (result.isEmpty()) {
            log.info("answer.no-evidence label={} attempted={} feedFailures={}",
                    result.label(), result.attempted(), result.feedFailures().size());
            return new Answer(AnswerStatus.NO_EVIDENCE, NO_EVIDENCE_MESSAGE, List.of());
        }

        try {
            String text = completionService.complete(promptBuilder.systemPrompt(), promptBuilder.userPrompt(query.text(), result));
            return new Answer(AnswerStatus.ANSWERED, text, result.evidence());
        } catch (CompletionException e) {
            log.warn("answer.completion.failed reason={}", e.getMessage());
            return new Answer(AnswerStatus.UPSTREAM_ERROR, UPSTREAM_ERROR_MESSAGE, result.evidence());
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
