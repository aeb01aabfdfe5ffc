package com.seorag.inference;

public interface CompletionService {
    String complete(String systemPrompt, String userPrompt) throws CompletionException;
}
