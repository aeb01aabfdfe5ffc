package com.seorag.retrieval;

public enum Provenance {
    STATIC_INDEX,
    FEED
}
