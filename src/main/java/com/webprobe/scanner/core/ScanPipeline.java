package com.webprobe.scanner.core;

import com.webprobe.scanner.config.HttpClientFactory;
import com.webprobe.scanner.crawler.OkHttpPageFetcher;
import com.webprobe.scanner.crawler.PageFetcher;
import com.webprobe.scanner.crawler.RetryPolicy;
import com.webprobe.scanner.crawler.Sleeper;
import com.webprobe.scanner.crawler.UrlNormalizer;
import com.webprobe.scanner.crawler.WebCrawler;
import com.webprobe.scanner.dynamic.ExecutionEngine;
import com.webprobe.scanner.dynamic.ExecutionStats;
import com.webprobe.scanner.dynamic.RequestSubmitter;
import com.webprobe.scanner.dynamic.TelemetryCollector;
import com.webprobe.scanner.dynamic.TestCaseExecutor;
import com.webprobe.scanner.fuzzing.TestCaseGenerator;
import com.webprobe.scanner.fuzzing.TestCaseSummary;
import com.webprobe.scanner.heuristics.ResponseClassifier;
import com.webprobe.scanner.models.CrawlResult;
import com.webprobe.scanner.models.Finding;
import com.webprobe.scanner.models.ScanResult;
import com.webprobe.scanner.models.TestCase;
import com.webprobe.scanner.payload.PayloadCatalog;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Полный цикл: обход, генерация, отбор, исполнение, классификация.
 *
 * <p>Экземпляр рассчитан на один запуск. cancel() можно вызвать из любого
 * потока (например, из shutdown hook): run() вернет частичный результат
 * с cancelled = true.</p>
 */
@Slf4j
public class ScanPipeline {

    private static final Comparator<Finding> FINDING_ORDER = Comparator
        .comparing((Finding finding) -> finding.getSeverity().getPriority()).reversed()
        .thenComparing(finding -> finding.getCategory().getId())
        .thenComparing(Finding::getUrl, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(Finding::getParam, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ScanOptions options;
    private final ScanEventListener listener;
    private final PageFetcher fetcher;
    private final RequestSubmitter submitter;
    private final ResponseClassifier classifier;
    private final TestCaseGenerator generator;
    private final TelemetryCollector telemetry;
    private final Sleeper sleeper;
    private final Clock clock;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile WebCrawler activeCrawler;
    private volatile ExecutionEngine activeEngine;

    @Builder
    private ScanPipeline(ScanOptions options,
                         ScanEventListener listener,
                         PageFetcher fetcher,
                         RequestSubmitter submitter,
                         ResponseClassifier classifier,
                         TestCaseGenerator generator,
                         Sleeper sleeper,
                         Clock clock) {
        if (options == null) {
            throw new IllegalArgumentException("options обязательны");
        }
        options.validate();
        this.options = options;
        this.listener = listener != null ? listener : ScanEventListener.NONE;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.telemetry = new TelemetryCollector();
        this.fetcher = fetcher != null ? fetcher : new OkHttpPageFetcher(options.getTimeoutSec());
        this.submitter = submitter != null
            ? submitter
            : new TestCaseExecutor(HttpClientFactory.create(options.getTimeoutSec()),
                options.getPlaceholderValue(), telemetry);
        this.classifier = classifier != null ? classifier : new ResponseClassifier();
        this.generator = generator != null ? generator : new TestCaseGenerator();
    }

    public ScanResult run() {
        Instant startedAt = clock.instant();
        String target = UrlNormalizer.normalize(options.getTargetUrl());
        listener.onScanStarted(options);

        CrawlResult crawl = crawl(target);

        PayloadCatalog catalog = PayloadCatalog.forProfile(options.getProfile());
        List<TestCase> generated = generator
            .generate(crawl.getParams(), crawl.getForms(), catalog, options.getMaxPerField())
            .collect(Collectors.toList());
        TestCaseSummary summary = TestCaseSummary.of(generated);
        List<TestCase> selected = select(generated);
        listener.onTestCasesPrepared(summary, selected.size());

        Queue<Finding> findings = new ConcurrentLinkedQueue<>();
        int executed = 0;
        if (!cancelled.get() && !selected.isEmpty()) {
            ExecutionStats stats = execute(selected, findings);
            executed = stats.getCompleted();
        }

        List<Finding> ordered = new ArrayList<>(findings);
        ordered.sort(FINDING_ORDER);

        List<String> notices = new ArrayList<>();
        if (!crawl.getUnreachable().isEmpty()) {
            notices.add("Недоступные страницы: " + crawl.getUnreachable().size());
        }
        notices.addAll(telemetry.buildNotices());

        ScanResult result = ScanResult.builder()
            .targetUrl(target)
            .crawl(crawl)
            .summary(summary)
            .selectedTests(selected.size())
            .executed(executed)
            .findings(List.copyOf(ordered))
            .notices(List.copyOf(notices))
            .cancelled(cancelled.get() || crawl.isCancelled())
            .startedAt(startedAt)
            .finishedAt(clock.instant())
            .build();
        listener.onScanFinished(result);
        return result;
    }

    /**
     * Остановить сканирование: новые запросы не отправляются, текущие обрываются.
     */
    public void cancel() {
        cancelled.set(true);
        WebCrawler crawler = activeCrawler;
        if (crawler != null) {
            crawler.cancel();
        }
        ExecutionEngine engine = activeEngine;
        if (engine != null) {
            engine.cancel();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * lab-only кейсы остаются только при профиле lab/all, затем общий лимит.
     */
    List<TestCase> select(List<TestCase> generated) {
        boolean allowLabOnly = options.getProfile().allowsLabOnly();
        List<TestCase> selected = generated.stream()
            .filter(testCase -> allowLabOnly || !testCase.isLabOnly())
            .limit(options.getMaxTests())
            .collect(Collectors.toList());
        if (selected.size() < generated.size()) {
            log.info("Отобрано {} из {} тест-кейсов (лимит {}, lab-only {})",
                selected.size(), generated.size(), options.getMaxTests(), allowLabOnly ? "разрешены" : "исключены");
        }
        return selected;
    }

    private CrawlResult crawl(String target) {
        WebCrawler crawler = WebCrawler.builder()
            .fetcher(fetcher)
            .sleeper(sleeper)
            .retryPolicy(new RetryPolicy(options.getMaxRetries(), sleeper))
            .concurrency(options.getConcurrency())
            .delay(Duration.ofMillis(options.getDelayMs()))
            .listener(listener)
            .build();
        activeCrawler = crawler;
        if (cancelled.get()) {
            crawler.cancel();
        }
        try {
            return crawler.crawl(target, options.getMaxDepth());
        } finally {
            activeCrawler = null;
        }
    }

    private ExecutionStats execute(List<TestCase> selected, Queue<Finding> findings) {
        ExecutionEngine engine = new ExecutionEngine(
            submitter, options.getConcurrency(), Duration.ofSeconds(options.getTimeoutSec()), listener);
        activeEngine = engine;
        if (cancelled.get()) {
            engine.cancel();
        }
        try {
            return engine.run(selected, (testCase, response) ->
                classifier.classify(testCase, response).ifPresent(finding -> {
                    findings.add(finding);
                    listener.onFinding(finding);
                }));
        } finally {
            activeEngine = null;
        }
    }
}
