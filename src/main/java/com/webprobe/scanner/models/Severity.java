package com.webprobe.scanner.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Уровни критичности находок
 */
public enum Severity {
    CRITICAL("Критический", 4),
    HIGH("Высокий", 3),
    MEDIUM("Средний", 2),
    LOW("Низкий", 1);

    private final String russianName;
    private final int priority;

    Severity(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getPriority() {
        return priority;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
