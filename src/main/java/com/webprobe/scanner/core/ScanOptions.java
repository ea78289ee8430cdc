package com.webprobe.scanner.core;

import com.webprobe.scanner.config.ConfigurationException;
import com.webprobe.scanner.config.ScannerConfig;
import com.webprobe.scanner.crawler.UrlNormalizer;
import com.webprobe.scanner.payload.PayloadProfile;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Параметры одного запуска сканирования.
 */
@Data
@Builder
public class ScanOptions {
    private String targetUrl;
    @Builder.Default
    private int maxDepth = 2;
    @Builder.Default
    private int concurrency = 5;
    @Builder.Default
    private long delayMs = 200L;
    @Builder.Default
    private int timeoutSec = 10;
    @Builder.Default
    private int maxRetries = 2;
    @Builder.Default
    private PayloadProfile profile = PayloadProfile.SAFE;
    @Builder.Default
    private int maxPerField = 2;
    @Builder.Default
    private int maxTests = 200;
    @Builder.Default
    private String placeholderValue = "test_value";

    public static ScanOptions fromConfig(ScannerConfig config) {
        ScannerConfig.Crawler crawler = config.getCrawler();
        ScannerConfig.Fuzzing fuzzing = config.getFuzzing();
        ScannerConfig.Execution execution = config.getExecution();
        return ScanOptions.builder()
            .maxDepth(crawler.getMaxDepth())
            .concurrency(crawler.getConcurrency())
            .delayMs(crawler.getDelayMs())
            .timeoutSec(crawler.getTimeoutSec())
            .maxRetries(crawler.getMaxRetries())
            .profile(PayloadProfile.parse(fuzzing.getProfile()))
            .maxPerField(fuzzing.getMaxPerField())
            .maxTests(fuzzing.getMaxTests())
            .placeholderValue(execution.getPlaceholderValue())
            .build();
    }

    /**
     * Проверка до любой сетевой активности.
     *
     * @throws ConfigurationException со списком всех нарушений
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        if (targetUrl == null || targetUrl.isBlank()) {
            problems.add("не указан целевой URL");
        } else if (UrlNormalizer.normalize(targetUrl) == null) {
            problems.add("целевой URL должен быть абсолютным http(s) адресом: " + targetUrl);
        }
        if (maxDepth < 0) {
            problems.add("глубина должна быть >= 0");
        }
        if (concurrency < 1) {
            problems.add("concurrency должен быть >= 1");
        }
        if (delayMs < 0) {
            problems.add("пауза не может быть отрицательной");
        }
        if (timeoutSec <= 0) {
            problems.add("таймаут должен быть > 0");
        }
        if (maxRetries < 0) {
            problems.add("число повторов должно быть >= 0");
        }
        if (profile == null) {
            problems.add("не указан профиль нагрузок");
        }
        if (maxPerField < 1) {
            problems.add("лимит нагрузок на поле должен быть >= 1");
        }
        if (maxTests < 1) {
            problems.add("лимит тест-кейсов должен быть >= 1");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Некорректные параметры сканирования: " + String.join("; ", problems));
        }
    }
}
