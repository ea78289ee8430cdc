package com.webprobe.scanner.core;

import com.webprobe.scanner.fuzzing.TestCaseSummary;
import com.webprobe.scanner.models.Finding;
import com.webprobe.scanner.models.ScanResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;

@Slf4j
public class LoggingScanEventListener implements ScanEventListener {

    @Override
    public void onScanStarted(ScanOptions options) {
        log.info("Сканирование {} (профиль {}, глубина {}, параллельность {})",
            options.getTargetUrl(), options.getProfile(), options.getMaxDepth(), options.getConcurrency());
    }

    @Override
    public void onPageFetched(String url, int depth, int statusCode) {
        log.debug("[{}] {} -> {}", depth, url, statusCode);
    }

    @Override
    public void onRetry(String url, int attempt, Duration pause, IOException cause) {
        log.info("Повтор {} (попытка {}) через {} с", url, attempt, pause.toSeconds());
    }

    @Override
    public void onUnreachable(String url, String error) {
        log.warn("Недоступен {}: {}", url, error);
    }

    @Override
    public void onTestCasesPrepared(TestCaseSummary generated, int selected) {
        log.info("Сгенерировано тест-кейсов: {} (lab-only {}), к исполнению: {}",
            generated.getTotal(), generated.getLabOnly(), selected);
        log.debug("По категориям: {}", generated.getByCategory());
    }

    @Override
    public void onFinding(Finding finding) {
        log.info("Находка [{}] {} {} param={} status={}",
            finding.getSeverity().getRussianName(), finding.getCategory().getId(),
            finding.getUrl(), finding.getParam(), finding.getStatusCode());
    }

    @Override
    public void onScanFinished(ScanResult result) {
        log.info("Сканирование завершено: находок {}, исполнено {}{}",
            result.getFindings().size(), result.getExecuted(), result.isCancelled() ? " (отменено)" : "");
    }
}
