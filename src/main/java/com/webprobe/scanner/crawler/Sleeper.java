package com.webprobe.scanner.crawler;

import java.time.Duration;

/**
 * Пауза между попытками и запросами. В тестах подменяется записывающей реализацией.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (duration != null && !duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
