package com.webprobe.scanner.models;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Нормализованный ответ на тест-кейс. statusCode = 0 означает сетевой сбой,
 * описание которого лежит в error.
 */
@Value
@Builder
public class ResponseRecord {
    int statusCode;
    @Builder.Default
    Map<String, String> headers = Map.of();
    @Builder.Default
    String body = "";
    String finalUrl;
    double elapsedSeconds;
    String error;

    public static ResponseRecord failure(String url, double elapsedSeconds, String error) {
        return ResponseRecord.builder()
            .statusCode(0)
            .finalUrl(url)
            .elapsedSeconds(elapsedSeconds)
            .error(error != null ? error : "unknown error")
            .build();
    }

    public boolean isFailure() {
        return statusCode == 0;
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }

    /**
     * Значение заголовка без учета регистра имени.
     */
    public String header(String name) {
        if (headers == null || headers.isEmpty() || name == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
