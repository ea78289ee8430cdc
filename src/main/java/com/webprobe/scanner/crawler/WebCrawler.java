package com.webprobe.scanner.crawler;

import com.webprobe.scanner.concurrent.BoundedExecutor;
import com.webprobe.scanner.config.ConfigurationException;
import com.webprobe.scanner.models.CrawlResult;
import com.webprobe.scanner.models.Form;
import com.webprobe.scanner.models.ParameterizedUrl;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Обход сайта в ширину с ограниченной параллельностью.
 *
 * <p>Уровень глубины d полностью завершается до того, как начнется уровень d+1.
 * Множество посещенных URL и все накопители принадлежат потоку, вызвавшему
 * crawl(); воркеры только загружают страницы и выдерживают паузу вежливости.
 * Разбор HTML выполняется после возврата разрешения.</p>
 *
 * <p>После cancel() экземпляр повторно не используется.</p>
 */
@Slf4j
public class WebCrawler {

    public static final int DEFAULT_CONCURRENCY = 5;
    public static final Duration DEFAULT_DELAY = Duration.ofMillis(200);

    private final PageFetcher fetcher;
    private final PageParser parser;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final int concurrency;
    private final Duration delay;
    private final CrawlListener listener;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile BoundedExecutor activeExecutor;

    @Builder
    private WebCrawler(PageFetcher fetcher,
                       PageParser parser,
                       RetryPolicy retryPolicy,
                       Sleeper sleeper,
                       Integer concurrency,
                       Duration delay,
                       CrawlListener listener) {
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher обязателен");
        }
        this.fetcher = fetcher;
        this.parser = parser != null ? parser : new PageParser();
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.retryPolicy = retryPolicy != null
            ? retryPolicy
            : new RetryPolicy(RetryPolicy.DEFAULT_MAX_RETRIES, this.sleeper);
        this.concurrency = concurrency != null ? concurrency : DEFAULT_CONCURRENCY;
        this.delay = delay != null ? delay : DEFAULT_DELAY;
        this.listener = listener != null ? listener : CrawlListener.NONE;
        if (this.concurrency < 1) {
            throw new ConfigurationException("concurrency должен быть >= 1: " + this.concurrency);
        }
        if (this.delay.isNegative()) {
            throw new ConfigurationException("delay не может быть отрицательным: " + this.delay);
        }
    }

    /**
     * Обойти сайт начиная с startUrl. Загружаются только страницы с глубиной не больше maxDepth.
     *
     * @throws ConfigurationException если стартовый URL не http(s) или maxDepth < 0
     */
    public CrawlResult crawl(String startUrl, int maxDepth) {
        String start = UrlNormalizer.normalize(startUrl);
        if (start == null) {
            throw new ConfigurationException("Некорректный стартовый URL: " + startUrl);
        }
        if (maxDepth < 0) {
            throw new ConfigurationException("maxDepth должен быть >= 0: " + maxDepth);
        }

        log.info("Обход {} (глубина {}, параллельность {}, пауза {} мс)",
            start, maxDepth, concurrency, delay.toMillis());
        long startedAt = System.nanoTime();

        Set<String> visited = new HashSet<>();
        Set<String> pages = new TreeSet<>();
        Map<Form.Key, Form> forms = new LinkedHashMap<>();
        Map<String, ParameterizedUrl> params = new LinkedHashMap<>();
        Set<String> unreachable = new TreeSet<>();

        List<String> level = new ArrayList<>();
        level.add(start);
        visited.add(start);

        try (BoundedExecutor executor = new BoundedExecutor("crawler", concurrency)) {
            activeExecutor = executor;
            if (cancelled.get()) {
                executor.cancel();
            }
            for (int depth = 0; depth <= maxDepth && !level.isEmpty() && !cancelled.get(); depth++) {
                List<PageOutcome> outcomes = runLevel(executor, level, depth);

                List<ParsedPage> parsedPages = new ArrayList<>();
                for (PageOutcome outcome : outcomes) {
                    if (outcome.unreachable()) {
                        unreachable.add(outcome.url());
                        continue;
                    }
                    if (outcome.result() == null || !outcome.result().isPage()) {
                        continue;
                    }
                    String pageUrl = pageUrlOf(outcome);
                    pages.add(pageUrl);
                    visited.add(pageUrl);

                    ParsedPage parsed = parser.parse(outcome.result().getBody(), pageUrl);
                    parsed.getForms().forEach(form -> forms.putIfAbsent(form.dedupKey(), form));
                    parsed.getParams().forEach(param -> params.putIfAbsent(param.getUrl(), param));
                    parsedPages.add(parsed);
                }

                List<String> next = new ArrayList<>();
                if (depth < maxDepth) {
                    for (ParsedPage parsed : parsedPages) {
                        for (String link : parsed.getLinks()) {
                            if (visited.add(link)) {
                                next.add(link);
                            }
                        }
                    }
                }
                log.debug("Уровень {}: загружено {}, в очереди на уровень {}: {}",
                    depth, outcomes.size(), depth + 1, next.size());
                level = next;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            log.warn("Обход прерван");
        } finally {
            activeExecutor = null;
        }

        CrawlResult result = CrawlResult.builder()
            .pages(List.copyOf(pages))
            .forms(List.copyOf(forms.values()))
            .params(List.copyOf(params.values()))
            .unreachable(List.copyOf(unreachable))
            .cancelled(cancelled.get())
            .build();

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        log.info("Обход завершен за {} мс: страниц {}, форм {}, параметризованных URL {}, недоступных {}",
            elapsedMs, pages.size(), forms.size(), params.size(), unreachable.size());
        listener.onCrawlFinished(result);
        return result;
    }

    /**
     * Остановить выдачу новых загрузок и оборвать текущие. crawl() вернет частичный результат.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Отмена обхода");
        }
        BoundedExecutor executor = activeExecutor;
        if (executor != null) {
            executor.cancel();
        }
        fetcher.cancelAll();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private List<PageOutcome> runLevel(BoundedExecutor executor, List<String> level, int depth)
            throws InterruptedException {
        List<String> dispatched = new ArrayList<>(level.size());
        List<Future<PageOutcome>> futures = new ArrayList<>(level.size());
        for (String url : level) {
            if (cancelled.get()) {
                break;
            }
            try {
                futures.add(executor.submit(() -> visit(url, depth)));
                dispatched.add(url);
            } catch (CancellationException e) {
                break;
            }
        }

        List<PageOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Ошибка при загрузке {}: {}", dispatched.get(i), cause.toString());
                outcomes.add(PageOutcome.unreachable(dispatched.get(i)));
            }
        }
        return outcomes;
    }

    /**
     * Выполняется в воркере под разрешением семафора.
     */
    private PageOutcome visit(String url, int depth) {
        if (cancelled.get()) {
            return PageOutcome.skipped(url);
        }
        PageOutcome outcome;
        try {
            FetchResult result = retryPolicy.execute(() -> {
                if (cancelled.get()) {
                    throw new CancellationException("обход отменен");
                }
                return fetcher.fetch(url);
            }, (attempt, pause, cause) -> {
                log.debug("Повтор {} через {} с (попытка {}): {}", url, pause.toSeconds(), attempt, cause.getMessage());
                listener.onRetry(url, attempt, pause, cause);
            });
            listener.onPageFetched(url, depth, result.getStatusCode());
            outcome = PageOutcome.fetched(url, result);
        } catch (IOException e) {
            if (cancelled.get()) {
                return PageOutcome.skipped(url);
            }
            log.debug("Не удалось загрузить {}: {}", url, e.getMessage());
            listener.onUnreachable(url, e.getMessage());
            outcome = PageOutcome.unreachable(url);
        } catch (CancellationException e) {
            return PageOutcome.skipped(url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PageOutcome.skipped(url);
        }
        pause();
        return outcome;
    }

    private void pause() {
        if (delay.isZero() || cancelled.get()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String pageUrlOf(PageOutcome outcome) {
        String finalUrl = UrlNormalizer.normalize(outcome.result().getFinalUrl(), outcome.url());
        return finalUrl != null ? finalUrl : outcome.url();
    }

    private record PageOutcome(String url, FetchResult result, boolean unreachable) {

        static PageOutcome fetched(String url, FetchResult result) {
            return new PageOutcome(url, result, false);
        }

        static PageOutcome unreachable(String url) {
            return new PageOutcome(url, null, true);
        }

        static PageOutcome skipped(String url) {
            return new PageOutcome(url, null, false);
        }
    }
}
