package com.webprobe.scanner.payload;

/**
 * Элемент каталога: литеральная строка или числовая директива для idor_numeric.
 */
public interface Payload {

    String getNote();

    /**
     * Человекочитаемое представление для логов и отчетов.
     */
    String describe();
}
