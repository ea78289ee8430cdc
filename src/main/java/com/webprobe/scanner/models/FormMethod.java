package com.webprobe.scanner.models;

import java.util.Locale;

/**
 * HTTP метод формы. Всё кроме post считается get.
 */
public enum FormMethod {
    GET,
    POST;

    public static FormMethod fromAttribute(String raw) {
        if (raw == null) {
            return GET;
        }
        return "post".equals(raw.trim().toLowerCase(Locale.ROOT)) ? POST : GET;
    }
}
