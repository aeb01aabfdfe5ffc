package com.seorag.feeds;

import java.util.List;

public interface FeedClient {
    List<FeedEntry> fetch(FeedSource source) throws FeedSourceException;
}
