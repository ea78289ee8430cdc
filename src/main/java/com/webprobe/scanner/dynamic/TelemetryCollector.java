package com.webprobe.scanner.dynamic;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Сетевая телеметрия исполнения тест-кейсов. Пишется из воркеров.
 */
public class TelemetryCollector {

    private final Queue<TelemetryEvent> events = new ConcurrentLinkedQueue<>();

    public void recordResponse(String method, String url, int statusCode, long durationMs) {
        events.add(TelemetryEvent.builder()
            .type(TelemetryEventType.RESPONSE)
            .method(method)
            .url(url)
            .statusCode(statusCode)
            .durationMs(durationMs)
            .build());
    }

    public void recordTimeout(String method, String url, long durationMs) {
        events.add(TelemetryEvent.builder()
            .type(TelemetryEventType.TIMEOUT)
            .method(method)
            .url(url)
            .durationMs(durationMs)
            .detail("timeout")
            .build());
    }

    public void recordNetworkError(String method, String url, String message) {
        events.add(TelemetryEvent.builder()
            .type(TelemetryEventType.NETWORK_ERROR)
            .method(method)
            .url(url)
            .detail(message)
            .build());
    }

    public void recordCancelled(String method, String url) {
        events.add(TelemetryEvent.builder()
            .type(TelemetryEventType.CANCELLED)
            .method(method)
            .url(url)
            .detail("cancelled")
            .build());
    }

    public TelemetrySummary summarize() {
        int totalResponses = 0;
        int success = 0;
        int redirects = 0;
        int clientErrors = 0;
        int serverErrors = 0;
        int timeouts = 0;
        int networkErrors = 0;
        int cancelled = 0;
        long totalLatency = 0;

        for (TelemetryEvent event : events) {
            switch (event.getType()) {
                case RESPONSE -> {
                    totalResponses++;
                    totalLatency += Math.max(0, event.getDurationMs());
                    int code = event.getStatusCode();
                    if (code >= 200 && code < 300) {
                        success++;
                    } else if (code >= 300 && code < 400) {
                        redirects++;
                    } else if (code >= 400 && code < 500) {
                        clientErrors++;
                    } else if (code >= 500) {
                        serverErrors++;
                    }
                }
                case TIMEOUT -> timeouts++;
                case NETWORK_ERROR -> networkErrors++;
                case CANCELLED -> cancelled++;
            }
        }

        return TelemetrySummary.builder()
            .totalResponses(totalResponses)
            .successResponses(success)
            .redirectResponses(redirects)
            .clientErrors(clientErrors)
            .serverErrors(serverErrors)
            .timeouts(timeouts)
            .networkErrors(networkErrors)
            .cancelled(cancelled)
            .totalLatencyMs(totalLatency)
            .build();
    }

    public List<String> buildNotices() {
        TelemetrySummary summary = summarize();
        List<String> notices = new ArrayList<>();
        if (summary.getTimeouts() > 0) {
            notices.add("Таймауты при отправке тест-кейсов: " + summary.getTimeouts());
        }
        if (summary.getNetworkErrors() > 0) {
            notices.add("Сетевые ошибки при отправке тест-кейсов: " + summary.getNetworkErrors());
        }
        if (summary.getServerErrors() > 0) {
            notices.add("Сервер вернул " + summary.getServerErrors() + " ответов 5xx на тестовые запросы");
        }
        return notices;
    }

    public List<TelemetryEvent> getEvents() {
        return List.copyOf(events);
    }
}
