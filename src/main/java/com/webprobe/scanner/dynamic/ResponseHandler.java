package com.webprobe.scanner.dynamic;

import com.webprobe.scanner.models.ResponseRecord;
import com.webprobe.scanner.models.TestCase;

/**
 * Обработчик ответа. Вызывается в пуле обработчиков, когда сетевое разрешение уже освобождено.
 */
@FunctionalInterface
public interface ResponseHandler {

    ResponseHandler IGNORE = (testCase, response) -> { };

    void handle(TestCase testCase, ResponseRecord response);
}
