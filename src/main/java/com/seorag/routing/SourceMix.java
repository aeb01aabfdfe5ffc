package com.seorag.routing;

public enum SourceMix {
    STATIC,
    LIVE,
    BOTH
}
