package com.seorag.routing;

public interface QueryClassifier {
    RouteDecision classify(String query);
}
