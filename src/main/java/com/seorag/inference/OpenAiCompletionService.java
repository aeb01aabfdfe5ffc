package com.seorag.inference;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Chat-completions client for OpenAI-compatible endpoints.
 *
 * <p>Network failures, HTTP 429 and 5xx responses are retried with linear backoff up to
 * {@code maxAttempts}. Other 4xx responses and replies without content fail at once.
 */
public class OpenAiCompletionService implements CompletionService {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionService.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_RETRY_BACKOFF_MS = 500;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final double temperature;
    private final String apiKey;
    private final int maxAttempts;
    private final long retryBackoffMs;

    public OpenAiCompletionService(OkHttpClient httpClient, String endpoint, String model, double temperature, String apiKey) {
        this(httpClient, endpoint, model, temperature, apiKey, DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_BACKOFF_MS);
    }

    public OpenAiCompletionService(
            OkHttpClient httpClient,
            String endpoint,
            String model,
            double temperature,
            String apiKey,
            int maxAttempts,
            long retryBackoffMs) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.temperature = temperature;
        this.apiKey = apiKey;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryBackoffMs = Math.max(0, retryBackoffMs);
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) throws CompletionException {
        String payload;
        try {
            payload = mapper.writeValueAsString(Map.of(
                    "model", model,
                    "temperature", temperature,
                    "messages", List.of(
                            Map.of("role", "system", "content", systemPrompt),
                            Map.of("role", "user", "content", userPrompt))));
        } catch (IOException e) {
            throw new CompletionException("Unable to encode completion request", e);
        }
        Request request = new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(payload, JSON))
                .build();

        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return send(request);
            } catch (TransientFailure e) {
                last = e;
            } catch (CompletionException e) {
                throw e;
            } catch (IOException e) {
                last = e;
            }
            if (attempt < maxAttempts) {
                long backoff = retryBackoffMs * attempt;
                log.warn("completion.retry attempt={} maxAttempts={} backoffMs={} reason={}",
                        attempt, maxAttempts, backoff, last.getMessage());
                sleep(backoff);
            }
        }
        throw new CompletionException("Completion request failed after " + maxAttempts + " attempts: " + last.getMessage(), last);
    }

    private String send(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            int code = response.code();
            if (code == 429 || code >= 500) {
                throw new TransientFailure("Completion request failed with HTTP " + code);
            }
            if (!response.isSuccessful() || response.body() == null) {
                throw new CompletionException("Completion request failed with HTTP " + code);
            }
            JsonNode content = mapper.readTree(response.body().string())
                    .path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new CompletionException("Completion response contained no message content");
            }
            return content.asText();
        }
    }

    private static void sleep(long millis) throws CompletionException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted while backing off", e);
        }
    }

    /** Rate limiting or a server-side error; worth another attempt. */
    private static final class TransientFailure extends CompletionException {
        private TransientFailure(String message) {
            super(message);
        }
    }
}
