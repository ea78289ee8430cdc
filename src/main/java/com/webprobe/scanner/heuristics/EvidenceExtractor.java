package com.webprobe.scanner.heuristics;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Фрагмент тела ответа, подтверждающий находку.
 */
public class EvidenceExtractor {

    public static final int DEFAULT_MAX_LENGTH = 500;
    public static final int DEFAULT_MARGIN = 100;

    private static final String ELLIPSIS = "...";

    private final int maxLength;
    private final int margin;

    public EvidenceExtractor() {
        this(DEFAULT_MAX_LENGTH, DEFAULT_MARGIN);
    }

    public EvidenceExtractor(int maxLength, int margin) {
        if (maxLength <= ELLIPSIS.length() * 2) {
            throw new IllegalArgumentException("maxLength слишком мал: " + maxLength);
        }
        this.maxLength = maxLength;
        this.margin = Math.max(0, margin);
    }

    /**
     * Окно +-margin символов вокруг первого вхождения needle (без учета регистра),
     * иначе начало тела. Результат никогда не длиннее maxLength, включая многоточия.
     */
    public String extract(String body, String needle) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        int index = indexOfIgnoreCase(body, needle);
        if (index < 0) {
            return truncate(body, 0);
        }
        int start = Math.max(0, index - margin);
        int end = Math.min(body.length(), index + needle.length() + margin);
        StringBuilder snippet = new StringBuilder();
        if (start > 0) {
            snippet.append(ELLIPSIS);
        }
        snippet.append(body, start, end);
        if (end < body.length()) {
            snippet.append(ELLIPSIS);
        }
        if (snippet.length() <= maxLength) {
            return snippet.toString();
        }
        return truncate(body, start);
    }

    private String truncate(String body, int from) {
        String prefix = from > 0 ? ELLIPSIS : "";
        String rest = body.substring(from);
        int budget = maxLength - prefix.length();
        if (rest.length() <= budget) {
            return prefix + rest;
        }
        return prefix + rest.substring(0, budget - ELLIPSIS.length()) + ELLIPSIS;
    }

    static int indexOfIgnoreCase(String text, String needle) {
        if (needle == null || needle.isEmpty()) {
            return -1;
        }
        Matcher matcher = Pattern.compile(Pattern.quote(needle), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
            .matcher(text);
        return matcher.find() ? matcher.start() : -1;
    }
}
