package com.webprobe.scanner.crawler;

import java.io.IOException;

/**
 * Загрузка страницы для краулера.
 * Транспортная ошибка сообщается через IOException, HTTP статусы ошибкой не считаются.
 */
public interface PageFetcher {

    FetchResult fetch(String url) throws IOException;

    /**
     * Прервать все запросы, которые сейчас в полете.
     */
    default void cancelAll() {
    }
}
