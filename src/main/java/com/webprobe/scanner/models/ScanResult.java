package com.webprobe.scanner.models;

import com.webprobe.scanner.fuzzing.TestCaseSummary;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Итог сканирования. При отмене содержит то, что успели собрать.
 */
@Value
@Builder
public class ScanResult {
    String targetUrl;
    CrawlResult crawl;
    TestCaseSummary summary;
    int selectedTests;
    int executed;
    @Builder.Default
    List<Finding> findings = List.of();
    @Builder.Default
    List<String> notices = List.of();
    boolean cancelled;
    Instant startedAt;
    Instant finishedAt;

    public Map<Severity, Long> countBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Finding finding : findings) {
            counts.merge(finding.getSeverity(), 1L, Long::sum);
        }
        return counts;
    }
}
