package com.seorag.routing;

/**
 * Decides whether a question belongs to search engine optimisation at all.
 */
public interface TopicClassifier {
    boolean isSeoRelated(String query);
}
