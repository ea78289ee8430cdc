package com.webprobe.scanner.dynamic;

import com.webprobe.scanner.models.ResponseRecord;
import com.webprobe.scanner.models.TestCase;

import java.time.Duration;

/**
 * Отправка одного тест-кейса.
 * Реализация не бросает исключений: любой сбой транспорта - ответ со статусом 0.
 */
public interface RequestSubmitter {

    ResponseRecord submit(TestCase testCase, Duration timeout);

    default void cancelAll() {
    }
}
