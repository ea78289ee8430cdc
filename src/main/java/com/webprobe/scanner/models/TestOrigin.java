package com.webprobe.scanner.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Откуда взята точка инъекции: query-параметр ссылки или поле формы.
 */
public enum TestOrigin {
    PARAM,
    FORM;

    @JsonValue
    public String getId() {
        return this == PARAM ? "param" : "form";
    }
}
