package com.webprobe.scanner.heuristics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceExtractorTest {

    private final EvidenceExtractor extractor = new EvidenceExtractor();

    @Test
    void windowAroundNeedleWithEllipses() {
        String body = "x".repeat(300) + "NEEDLE" + "y".repeat(300);

        String evidence = extractor.extract(body, "needle");

        assertEquals("..." + "x".repeat(100) + "NEEDLE" + "y".repeat(100) + "...", evidence);
    }

    @Test
    void needleNearStartHasNoLeadingEllipsis() {
        assertEquals("abc <b> def", extractor.extract("abc <b> def", "<b>"));
    }

    @Test
    void missingNeedleFallsBackToBodyPrefix() {
        String body = "z".repeat(1000);

        String evidence = extractor.extract(body, "absent");

        assertEquals(500, evidence.length());
        assertTrue(evidence.endsWith("..."));
        assertEquals("short body", extractor.extract("short body", null));
    }

    @Test
    void oversizedWindowIsTruncatedToLimit() {
        EvidenceExtractor small = new EvidenceExtractor(20, 5);
        String body = "a".repeat(10) + "b".repeat(40) + "c".repeat(10);

        String evidence = small.extract(body, "b".repeat(40));

        assertEquals(20, evidence.length());
        assertEquals("..." + "a".repeat(5) + "b".repeat(9) + "...", evidence);
    }

    @Test
    void emptyBodyGivesEmptyEvidence() {
        assertEquals("", extractor.extract("", "x"));
        assertEquals("", extractor.extract(null, "x"));
    }

    @Test
    void tinyLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EvidenceExtractor(6, 10));
    }
}
