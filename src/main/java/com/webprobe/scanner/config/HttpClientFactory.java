package com.webprobe.scanner.config;

import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Общие настройки HTTP клиента для краулера и движка исполнения.
 */
public final class HttpClientFactory {

    public static final String USER_AGENT = "WebProbeScanner/1.0 (authorized security testing)";
    public static final String ACCEPT = "text/html,application/xhtml+xml";

    private HttpClientFactory() {
    }

    /**
     * Клиент со следованием редиректам и общим таймаутом на вызов.
     * Повторы запроса делает RetryPolicy; OkHttp только переоткрывает устаревшие соединения из пула.
     */
    public static OkHttpClient create(int timeoutSec) {
        if (timeoutSec <= 0) {
            throw new ConfigurationException("timeout должен быть > 0: " + timeoutSec);
        }
        return new OkHttpClient.Builder()
            .connectTimeout(timeoutSec, TimeUnit.SECONDS)
            .readTimeout(timeoutSec, TimeUnit.SECONDS)
            .writeTimeout(timeoutSec, TimeUnit.SECONDS)
            .callTimeout(timeoutSec, TimeUnit.SECONDS)
            .followRedirects(true)
            .followSslRedirects(true)
            .retryOnConnectionFailure(true)
            .build();
    }
}
