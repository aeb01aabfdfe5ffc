package com.seorag.routing;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.seorag.runtime.AppConfig;

class LexicalTopicClassifierTest {
    private final LexicalTopicClassifier classifier = new LexicalTopicClassifier();

    @Test
    void shouldAcceptQuestionsWithAnEssentialTerm() {
        assertTrue(classifier.isSeoRelated("What is hreflang?"));
        assertTrue(classifier.isSeoRelated("How should duplicate pages point to a canonical URL?"));
        assertTrue(classifier.isSeoRelated("サイトマップの作り方"));
    }

    @Test
    void shouldAcceptRelatedTermsInPairsOrInShortQuestions() {
        assertTrue(classifier.isSeoRelated("How do internal links and thin content affect trust"));
        assertTrue(classifier.isSeoRelated("internal links"));
        assertFalse(classifier.isSeoRelated("How many links does a chain have in total"));
    }

    @Test
    void shouldAcceptDefinitionQuestionsAboutNewAcronyms() {
        assertTrue(classifier.isSeoRelated("What is SGE?"));
        assertTrue(classifier.isSeoRelated("FLUQsとは"));
        assertFalse(classifier.isSeoRelated("What is NASA planning for the moon next year?"));
    }

    @Test
    void shouldRejectExcludedAndUnrelatedQuestions() {
        assertFalse(classifier.isSeoRelated("Best pasta recipe for dinner?"));
        assertFalse(classifier.isSeoRelated("Google recipes for banana bread"));
        assertFalse(classifier.isSeoRelated("How do I fix a python import error"));
        assertFalse(classifier.isSeoRelated("What is the capital of France?"));
        assertFalse(classifier.isSeoRelated("  "));
        assertFalse(classifier.isSeoRelated(null));
    }

    @Test
    void shouldUseConfiguredTermLists() {
        AppConfig.TopicConfig config = new AppConfig.TopicConfig();
        config.setEssentialTerms(List.of("Widget"));
        config.setRelatedTerms(List.of());
        config.setExcludeTerms(List.of());

        LexicalTopicClassifier custom = new LexicalTopicClassifier(config);

        assertTrue(custom.isSeoRelated("widget tuning tips"));
        assertFalse(custom.isSeoRelated("canonical tags"));
    }
}
