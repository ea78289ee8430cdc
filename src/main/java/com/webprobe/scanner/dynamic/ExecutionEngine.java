package com.webprobe.scanner.dynamic;

import com.webprobe.scanner.concurrent.BoundedExecutor;
import com.webprobe.scanner.config.ConfigurationException;
import com.webprobe.scanner.models.ResponseRecord;
import com.webprobe.scanner.models.TestCase;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Исполнение тест-кейсов с ограниченной параллельностью.
 *
 * <p>Каждый кейс отправляется не более одного раза. Сетевой воркер
 * освобождает разрешение сразу после ответа, а обработчик исполняется
 * в отдельном пуле. Исключение обработчика логируется и на остальные
 * кейсы не влияет.</p>
 */
@Slf4j
public class ExecutionEngine {

    public static final int DEFAULT_CONCURRENCY = 5;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final RequestSubmitter submitter;
    private final int concurrency;
    private final Duration timeout;
    private final ExecutionListener listener;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile BoundedExecutor activeExecutor;

    public ExecutionEngine(RequestSubmitter submitter, int concurrency, Duration timeout) {
        this(submitter, concurrency, timeout, ExecutionListener.NONE);
    }

    public ExecutionEngine(RequestSubmitter submitter, int concurrency, Duration timeout, ExecutionListener listener) {
        if (submitter == null) {
            throw new IllegalArgumentException("submitter обязателен");
        }
        if (concurrency < 1) {
            throw new ConfigurationException("concurrency должен быть >= 1: " + concurrency);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("timeout должен быть > 0: " + timeout);
        }
        this.submitter = submitter;
        this.concurrency = concurrency;
        this.timeout = timeout;
        this.listener = listener != null ? listener : ExecutionListener.NONE;
    }

    public ExecutionStats run(Collection<TestCase> cases, ResponseHandler handler) {
        return run(cases.stream(), handler);
    }

    /**
     * Исполнить все кейсы из потока. Блокирует до завершения последнего ответа или отмены.
     */
    public ExecutionStats run(Stream<TestCase> cases, ResponseHandler handler) {
        ResponseHandler safeHandler = handler != null ? handler : ResponseHandler.IGNORE;
        long startedAt = System.nanoTime();
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger handlerErrors = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        Queue<Future<?>> handlerFutures = new ConcurrentLinkedQueue<>();
        ExecutorService handlers = Executors.newFixedThreadPool(concurrency, BoundedExecutor.daemonThreads("handler"));

        try (BoundedExecutor executor = new BoundedExecutor("executor", concurrency)) {
            activeExecutor = executor;
            if (cancelled.get()) {
                executor.cancel();
            }
            Iterator<TestCase> iterator = cases.iterator();
            while (iterator.hasNext() && !cancelled.get()) {
                TestCase testCase = iterator.next();
                try {
                    futures.add(executor.submit(() -> {
                        ResponseRecord response = fetch(testCase);
                        if (response != null) {
                            dispatchHandler(handlers, handlerFutures, () ->
                                handle(testCase, response, safeHandler, completed, failed, handlerErrors));
                        }
                        return null;
                    }));
                } catch (CancellationException e) {
                    break;
                }
            }
            awaitAll(futures);
            awaitAll(new ArrayList<>(handlerFutures));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            log.warn("Исполнение прервано");
        } finally {
            activeExecutor = null;
            handlers.shutdownNow();
        }

        ExecutionStats stats = ExecutionStats.builder()
            .dispatched(futures.size())
            .completed(completed.get())
            .failed(failed.get())
            .handlerErrors(handlerErrors.get())
            .cancelled(cancelled.get())
            .elapsedMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt))
            .build();
        log.info("Исполнено {} из {} тест-кейсов за {} мс (сбоев транспорта {})",
            stats.getCompleted(), stats.getDispatched(), stats.getElapsedMs(), stats.getFailed());
        listener.onExecutionFinished(stats);
        return stats;
    }

    /**
     * Прекратить выдачу новых кейсов и оборвать запросы в полете.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Отмена исполнения тест-кейсов");
        }
        BoundedExecutor executor = activeExecutor;
        if (executor != null) {
            executor.cancel();
        }
        submitter.cancelAll();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private ResponseRecord fetch(TestCase testCase) {
        if (cancelled.get()) {
            return null;
        }
        return submitter.submit(testCase, timeout);
    }

    private static void dispatchHandler(ExecutorService handlers, Queue<Future<?>> handlerFutures, Runnable task) {
        try {
            handlerFutures.add(handlers.submit(task));
        } catch (RejectedExecutionException e) {
            log.debug("Пул обработчиков остановлен, ответ не обработан");
        }
    }

    private void handle(TestCase testCase,
                        ResponseRecord response,
                        ResponseHandler handler,
                        AtomicInteger completed,
                        AtomicInteger failed,
                        AtomicInteger handlerErrors) {
        completed.incrementAndGet();
        if (response.isFailure()) {
            failed.incrementAndGet();
        }
        try {
            handler.handle(testCase, response);
        } catch (RuntimeException e) {
            handlerErrors.incrementAndGet();
            log.warn("Ошибка обработчика для тест-кейса {}: {}", testCase.getId(), e.toString());
        }
        listener.onCaseCompleted(testCase, response);
    }

    private static void awaitAll(Collection<Future<?>> futures) throws InterruptedException {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Сбой воркера: {}", cause.toString());
            }
        }
    }
}
