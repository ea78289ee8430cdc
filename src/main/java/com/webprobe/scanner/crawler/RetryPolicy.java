package com.webprobe.scanner.crawler;

import java.io.IOException;
import java.time.Duration;

/**
 * Повтор сетевой операции с экспоненциальной паузой 2^attempt секунд.
 * maxRetries = 2 означает до трех попыток всего.
 */
public class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 2;

    private final int maxRetries;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries < 0: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, Sleeper.SYSTEM);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Пауза перед повтором после неудачной попытки номер attempt (с нуля).
     */
    public Duration backoff(int attempt) {
        return Duration.ofSeconds(1L << Math.min(attempt, 30));
    }

    public <T> T execute(Attempt<T> action) throws IOException, InterruptedException {
        return execute(action, RetryListener.NONE);
    }

    /**
     * Выполнить action; при IOException повторить, пока не исчерпан бюджет.
     * Последнее исключение пробрасывается вызывающему.
     */
    public <T> T execute(Attempt<T> action, RetryListener listener) throws IOException, InterruptedException {
        RetryListener callback = listener != null ? listener : RetryListener.NONE;
        IOException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.call();
            } catch (IOException e) {
                last = e;
                if (attempt < maxRetries) {
                    Duration pause = backoff(attempt);
                    callback.onRetry(attempt + 1, pause, e);
                    sleeper.sleep(pause);
                }
            }
        }
        throw last;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws IOException;
    }

    @FunctionalInterface
    public interface RetryListener {
        RetryListener NONE = (attempt, pause, cause) -> { };

        void onRetry(int attempt, Duration pause, IOException cause);
    }
}
