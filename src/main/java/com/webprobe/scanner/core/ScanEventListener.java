package com.webprobe.scanner.core;

import com.webprobe.scanner.crawler.CrawlListener;
import com.webprobe.scanner.dynamic.ExecutionListener;
import com.webprobe.scanner.fuzzing.TestCaseSummary;
import com.webprobe.scanner.models.Finding;
import com.webprobe.scanner.models.ScanResult;

/**
 * Приемник событий сканирования. Ядро не пишет в консоль само,
 * все прогресс-события идут сюда. Методы вызываются из разных потоков.
 */
public interface ScanEventListener extends CrawlListener, ExecutionListener {

    ScanEventListener NONE = new ScanEventListener() {
    };

    default void onScanStarted(ScanOptions options) {
    }

    default void onTestCasesPrepared(TestCaseSummary generated, int selected) {
    }

    default void onFinding(Finding finding) {
    }

    default void onScanFinished(ScanResult result) {
    }
}
