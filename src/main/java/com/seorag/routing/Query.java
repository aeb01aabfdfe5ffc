package com.seorag.routing;

public record Query(String text, SourceMix label) {
}
