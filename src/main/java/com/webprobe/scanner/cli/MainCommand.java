package com.webprobe.scanner.cli;

import com.webprobe.scanner.config.ConfigurationException;
import com.webprobe.scanner.config.ScannerConfig;
import com.webprobe.scanner.core.LoggingScanEventListener;
import com.webprobe.scanner.core.ScanOptions;
import com.webprobe.scanner.core.ScanPipeline;
import com.webprobe.scanner.heuristics.ResponseClassifier;
import com.webprobe.scanner.models.Finding;
import com.webprobe.scanner.models.ScanResult;
import com.webprobe.scanner.payload.PayloadProfile;
import com.webprobe.scanner.reports.JsonResultWriter;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI запуск сканирования одного сайта.
 */
@Slf4j
@Command(
    name = "web-probe-scanner",
    mixinStandardHelpOptions = true,
    version = "Web Probe Scanner 1.0.0",
    description = """

        Web Probe Scanner

        Обход сайта, генерация тест-кейсов и поиск признаков уязвимостей
        (XSS, SQL/command injection, раскрытие информации, аномалии сервера).

        Запускайте только против систем, на тестирование которых есть разрешение.

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_CANCELLED = 130;

    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    @Option(names = {"-u", "--url"}, required = true, description = "Целевой URL (http/https)")
    private String targetUrl;

    @Option(names = {"-d", "--depth"}, description = "Глубина обхода (по умолчанию из конфигурации: 2)")
    private Integer depth;

    @Option(names = {"-c", "--concurrency"}, description = "Число одновременных запросов (по умолчанию: 5)")
    private Integer concurrency;

    @Option(names = {"--delay-ms"}, description = "Пауза после каждой загрузки страницы, мс (по умолчанию: 200)")
    private Long delayMs;

    @Option(names = {"--timeout"}, description = "Таймаут запроса, секунды (по умолчанию: 10)")
    private Integer timeoutSec;

    @Option(names = {"--profile"}, description = "Профиль нагрузок: safe, lab, all (по умолчанию: safe)")
    private String profile;

    @Option(names = {"--lab"}, description = "Разрешить lab-only нагрузки (то же, что --profile lab, перекрывает --profile)")
    private boolean lab;

    @Option(names = {"--max-per-field"}, description = "Нагрузок на поле в каждой категории (по умолчанию: 2)")
    private Integer maxPerField;

    @Option(names = {"--max-tests"}, description = "Максимум тест-кейсов (по умолчанию: 200)")
    private Integer maxTests;

    @Option(names = {"-o", "--out"}, description = "Файл для JSON результата")
    private Path out;

    @Option(names = {"--config"}, description = "YAML файл конфигурации вместо встроенного")
    private Path configPath;

    private final PrintStream console;

    public MainCommand() {
        this(System.out);
    }

    MainCommand(PrintStream console) {
        this.console = console;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        ScanPipeline pipeline;
        ScannerConfig config;
        try {
            config = configPath != null ? ScannerConfig.load(configPath) : ScannerConfig.load();
            ScanOptions options = buildOptions(config);
            pipeline = ScanPipeline.builder()
                .options(options)
                .listener(new LoggingScanEventListener())
                .classifier(ResponseClassifier.fromConfig(config.getClassifier(), Clock.systemUTC()))
                .build();
        } catch (ConfigurationException e) {
            log.error("Ошибка конфигурации: {}", e.getMessage());
            console.println("Ошибка конфигурации: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(cancelAndAwait(pipeline::cancel, finished, SHUTDOWN_GRACE), "scan-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            ScanResult result = pipeline.run();
            printSummary(result);
            if (out != null) {
                new JsonResultWriter().write(result, out);
                console.println("JSON результат: " + out.toAbsolutePath());
            }
            return result.isCancelled() ? EXIT_CANCELLED : EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Ошибка конфигурации: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            log.error("Не удалось записать результат: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Сканирование завершилось ошибкой", e);
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    /**
     * Действие хука остановки: отменить скан и дождаться, пока частичный
     * результат будет напечатан и записан, но не дольше {@code grace}.
     */
    static Runnable cancelAndAwait(Runnable cancel, CountDownLatch finished, Duration grace) {
        return () -> {
            cancel.run();
            try {
                if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Частичный результат не записан за {} с", grace.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    /**
     * Значения из конфигурации, поверх них флаги командной строки.
     */
    ScanOptions buildOptions(ScannerConfig config) {
        ScanOptions options = ScanOptions.fromConfig(config);
        options.setTargetUrl(targetUrl);
        if (depth != null) {
            options.setMaxDepth(depth);
        }
        if (concurrency != null) {
            options.setConcurrency(concurrency);
        }
        if (delayMs != null) {
            options.setDelayMs(delayMs);
        }
        if (timeoutSec != null) {
            options.setTimeoutSec(timeoutSec);
        }
        if (profile != null) {
            options.setProfile(PayloadProfile.parse(profile));
        }
        if (lab) {
            options.setProfile(PayloadProfile.LAB);
        }
        if (maxPerField != null) {
            options.setMaxPerField(maxPerField);
        }
        if (maxTests != null) {
            options.setMaxTests(maxTests);
        }
        options.validate();
        return options;
    }

    private void printSummary(ScanResult result) {
        console.println();
        console.println("Цель: " + result.getTargetUrl());
        console.println("Страниц: " + result.getCrawl().getPages().size()
            + ", форм: " + result.getCrawl().getForms().size()
            + ", параметризованных URL: " + result.getCrawl().getParams().size());
        console.println("Тест-кейсов: " + result.getSummary().getTotal()
            + ", отобрано: " + result.getSelectedTests()
            + ", исполнено: " + result.getExecuted());
        console.println("Находок: " + result.getFindings().size() + " " + result.countBySeverity());
        for (Finding finding : result.getFindings()) {
            console.printf("  [%s] %s %s %s param=%s%n",
                finding.getSeverity().getRussianName(),
                finding.getCategory().getId(),
                finding.getMethod(),
                finding.getUrl(),
                finding.getParam());
        }
        result.getNotices().forEach(notice -> console.println("! " + notice));
        if (result.isCancelled()) {
            console.println("Сканирование отменено, результат частичный");
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM уже завершается, hook не снят: {}", e.getMessage());
        }
    }
}
