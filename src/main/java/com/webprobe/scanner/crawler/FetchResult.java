package com.webprobe.scanner.crawler;

import lombok.Builder;
import lombok.Value;

/**
 * Ответ на GET страницы после всех редиректов.
 */
@Value
@Builder
public class FetchResult {
    int statusCode;
    String finalUrl;
    @Builder.Default
    String body = "";
    String contentType;

    public boolean isPage() {
        return statusCode != 0 && body != null && !body.isEmpty();
    }
}
