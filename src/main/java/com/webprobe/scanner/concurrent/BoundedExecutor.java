package com.webprobe.scanner.concurrent;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Пул воркеров с семафором на стороне диспетчера.
 *
 * submit() блокирует вызывающий поток, пока в работе уже concurrency задач,
 * разрешение возвращается в finally самой задачи. cancel() прекращает
 * прием новых задач и прерывает занятые воркеры.
 */
@Slf4j
public class BoundedExecutor implements AutoCloseable {

    private final String name;
    private final int concurrency;
    private final ExecutorService pool;
    private final Semaphore permits;
    private final Set<Thread> busyWorkers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BoundedExecutor(String name, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency должен быть >= 1: " + concurrency);
        }
        this.name = name;
        this.concurrency = concurrency;
        this.permits = new Semaphore(concurrency);
        this.pool = Executors.newFixedThreadPool(concurrency, daemonThreads(name));
    }

    /**
     * Отправить задачу, дождавшись свободного разрешения.
     *
     * @throws CancellationException если исполнитель уже отменен
     * @throws InterruptedException если поток диспетчера прерван во время ожидания
     */
    public <T> Future<T> submit(Callable<T> task) throws InterruptedException {
        if (cancelled.get()) {
            throw new CancellationException(name + ": отменено");
        }
        permits.acquire();
        if (cancelled.get()) {
            permits.release();
            throw new CancellationException(name + ": отменено");
        }
        try {
            return pool.submit(() -> runWithPermit(task));
        } catch (RejectedExecutionException e) {
            permits.release();
            throw new CancellationException(name + ": пул остановлен");
        }
    }

    private <T> T runWithPermit(Callable<T> task) throws Exception {
        Thread self = Thread.currentThread();
        busyWorkers.add(self);
        try {
            return task.call();
        } finally {
            busyWorkers.remove(self);
            permits.release();
        }
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.debug("{}: отмена, прерываем {} активных воркеров", name, busyWorkers.size());
            busyWorkers.forEach(Thread::interrupt);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Сколько задач выполняется прямо сейчас.
     */
    public int inFlight() {
        return concurrency - permits.availablePermits();
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Фабрика демон-потоков с именами {@code prefix-N}.
     */
    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
