package com.webprobe.scanner.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Категория находки классификатора ответов.
 */
public enum FindingCategory {
    XSS("xss"),
    SQLI("sqli"),
    COMMAND_INJECTION("command_injection"),
    INFO_DISCLOSURE("info_disclosure"),
    ERROR("error"),
    ANOMALY("anomaly");

    private final String id;

    FindingCategory(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
