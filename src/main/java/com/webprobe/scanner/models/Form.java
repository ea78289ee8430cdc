package com.webprobe.scanner.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * HTML форма, найденная краулером.
 * Ключ дедупликации: (pageUrl, actionUrl, method).
 */
@Value
@Builder
public class Form {
    String pageUrl;
    String actionUrl;
    FormMethod method;
    List<String> inputNames;

    public Key dedupKey() {
        return new Key(pageUrl, actionUrl, method);
    }

    public record Key(String pageUrl, String actionUrl, FormMethod method) {
    }
}
