package com.webprobe.scanner.dynamic;

public enum TelemetryEventType {
    RESPONSE,
    TIMEOUT,
    NETWORK_ERROR,
    CANCELLED
}
