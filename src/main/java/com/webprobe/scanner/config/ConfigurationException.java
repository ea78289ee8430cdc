package com.webprobe.scanner.config;

/**
 * Ошибка конфигурации запуска. Бросается до начала сетевой активности.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
