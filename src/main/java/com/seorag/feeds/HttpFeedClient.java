package com.seorag.feeds;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpFeedClient implements FeedClient {
    private final OkHttpClient httpClient;
    private final FeedParser parser;
    private final String userAgent;

    public HttpFeedClient(OkHttpClient baseClient, Duration timeout, String userAgent) {
        this(baseClient.newBuilder().callTimeout(timeout).build(), new FeedParser(), userAgent);
    }

    HttpFeedClient(OkHttpClient httpClient, FeedParser parser, String userAgent) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.userAgent = userAgent;
    }

    @Override
    public List<FeedEntry> fetch(FeedSource source) throws FeedSourceException {
        Request request = new Request.Builder()
                .url(source.url())
                .header("User-Agent", userAgent)
                .header("Accept", acceptHeader(source.fetchMethod()))
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new FeedSourceException(source.name(), "HTTP " + response.code());
            }
            return parser.parse(source, body.string());
        } catch (FeedSourceException e) {
            throw e;
        } catch (IOException e) {
            throw new FeedSourceException(source.name(), "request failed: " + e.getMessage(), e);
        }
    }

    private static String acceptHeader(FetchMethod method) {
        return switch (method) {
            case HTML -> "text/html,application/xhtml+xml";
            case ATOM -> "application/atom+xml,application/xml;q=0.9,*/*;q=0.8";
            case RSS -> "application/rss+xml,application/xml;q=0.9,*/*;q=0.8";
        };
    }
}
