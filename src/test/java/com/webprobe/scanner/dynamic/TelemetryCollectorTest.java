package com.webprobe.scanner.dynamic;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryCollectorTest {

    @Test
    void summaryGroupsResponsesByStatusClass() {
        TelemetryCollector collector = new TelemetryCollector();
        collector.recordResponse("GET", "http://x.test/a", 200, 40);
        collector.recordResponse("GET", "http://x.test/b", 302, 10);
        collector.recordResponse("POST", "http://x.test/c", 404, 20);
        collector.recordResponse("GET", "http://x.test/d", 503, 30);
        collector.recordTimeout("GET", "http://x.test/e", 1000);
        collector.recordNetworkError("GET", "http://x.test/f", "connection refused");
        collector.recordCancelled("GET", "http://x.test/g");

        TelemetrySummary summary = collector.summarize();

        assertEquals(4, summary.getTotalResponses());
        assertEquals(1, summary.getSuccessResponses());
        assertEquals(1, summary.getRedirectResponses());
        assertEquals(1, summary.getClientErrors());
        assertEquals(1, summary.getServerErrors());
        assertEquals(1, summary.getTimeouts());
        assertEquals(1, summary.getNetworkErrors());
        assertEquals(1, summary.getCancelled());
        assertEquals(25, summary.averageLatencyMs());
        assertEquals(7, collector.getEvents().size());
    }

    @Test
    void noticesOnlyForProblems() {
        TelemetryCollector collector = new TelemetryCollector();
        collector.recordResponse("GET", "http://x.test/", 200, 5);
        assertTrue(collector.buildNotices().isEmpty());

        collector.recordTimeout("GET", "http://x.test/slow", 10_000);
        collector.recordResponse("GET", "http://x.test/err", 500, 5);
        List<String> notices = collector.buildNotices();
        assertEquals(2, notices.size());
        assertTrue(notices.get(0).contains("1"));
    }

    @Test
    void concurrentWritersLoseNothing() throws Exception {
        TelemetryCollector collector = new TelemetryCollector();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 400; i++) {
            int n = i;
            pool.execute(() -> collector.recordResponse("GET", "http://x.test/" + n, 200, 1));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(400, collector.summarize().getTotalResponses());
    }
}
