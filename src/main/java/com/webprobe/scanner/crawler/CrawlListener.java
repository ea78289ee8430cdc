package com.webprobe.scanner.crawler;

import com.webprobe.scanner.models.CrawlResult;

import java.io.IOException;
import java.time.Duration;

/**
 * События обхода. Вызываются из воркеров, реализации должны быть потокобезопасны.
 */
public interface CrawlListener {

    CrawlListener NONE = new CrawlListener() {
    };

    default void onPageFetched(String url, int depth, int statusCode) {
    }

    default void onRetry(String url, int attempt, Duration pause, IOException cause) {
    }

    default void onUnreachable(String url, String error) {
    }

    default void onCrawlFinished(CrawlResult result) {
    }
}
