package com.webprobe.scanner.dynamic;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TelemetryEvent {
    TelemetryEventType type;
    String url;
    String method;
    int statusCode;
    long durationMs;
    String detail;
}
