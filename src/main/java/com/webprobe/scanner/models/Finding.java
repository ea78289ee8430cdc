package com.webprobe.scanner.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Находка классификатора: признак уязвимости в ответе на конкретный тест-кейс.
 */
@Value
@Builder
public class Finding {
    String id;
    FindingCategory category;
    Severity severity;
    String url;
    String param;
    String method;
    String payload;
    int statusCode;
    String evidence;
    String finalUrl;
    double responseTimeSeconds;
    Instant timestamp;
}
