package com.webprobe.scanner.dynamic;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TelemetrySummary {
    @Builder.Default
    private int totalResponses = 0;
    @Builder.Default
    private int successResponses = 0;
    @Builder.Default
    private int redirectResponses = 0;
    @Builder.Default
    private int clientErrors = 0;
    @Builder.Default
    private int serverErrors = 0;
    @Builder.Default
    private int timeouts = 0;
    @Builder.Default
    private int networkErrors = 0;
    @Builder.Default
    private int cancelled = 0;
    @Builder.Default
    private long totalLatencyMs = 0;

    public long averageLatencyMs() {
        return totalResponses > 0 ? totalLatencyMs / totalResponses : 0;
    }
}
