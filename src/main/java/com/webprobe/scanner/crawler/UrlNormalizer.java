package com.webprobe.scanner.crawler;

import okhttp3.HttpUrl;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Нормализация ссылок, найденных на странице.
 *
 * Результат всегда абсолютный http(s) URL без фрагмента в каноническом
 * виде OkHttp, поэтому normalize(normalize(u)) == normalize(u).
 * Все, что не удалось разобрать, превращается в null.
 */
public final class UrlNormalizer {

    private static final Set<String> REJECTED_SCHEMES = Set.of("mailto", "tel", "javascript", "data", "ftp");

    private UrlNormalizer() {
    }

    public static String normalize(String link) {
        return normalize(link, null);
    }

    /**
     * @param link сырое значение href/action
     * @param base адрес страницы, относительно которой разрешается ссылка (может быть null)
     */
    public static String normalize(String link, String base) {
        if (link == null || link.isBlank()) {
            return null;
        }
        String trimmed = link.trim();
        String scheme = schemeOf(trimmed);
        if (scheme != null && (REJECTED_SCHEMES.contains(scheme) || !isHttp(scheme))) {
            return null;
        }

        HttpUrl resolved;
        if (scheme != null) {
            resolved = HttpUrl.parse(trimmed);
        } else {
            HttpUrl baseUrl = base != null ? HttpUrl.parse(base.trim()) : null;
            resolved = baseUrl != null ? baseUrl.resolve(trimmed) : null;
        }
        if (resolved == null) {
            return null;
        }
        return resolved.newBuilder().fragment(null).build().toString();
    }

    /**
     * Имена query-параметров в порядке появления, включая параметры с пустым значением.
     */
    public static Set<String> queryParamNames(String url) {
        HttpUrl parsed = url != null ? HttpUrl.parse(url) : null;
        if (parsed == null || parsed.querySize() == 0) {
            return Collections.emptySet();
        }
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < parsed.querySize(); i++) {
            String name = parsed.queryParameterName(i);
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return Collections.unmodifiableSet(names);
    }

    private static boolean isHttp(String scheme) {
        return "http".equals(scheme) || "https".equals(scheme);
    }

    /**
     * Схема по RFC 3986: буква, затем буквы, цифры, '+', '-', '.' до первого ':'.
     */
    private static String schemeOf(String link) {
        int colon = link.indexOf(':');
        if (colon <= 0) {
            return null;
        }
        if (!Character.isLetter(link.charAt(0))) {
            return null;
        }
        for (int i = 1; i < colon; i++) {
            char c = link.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '+' && c != '-' && c != '.') {
                return null;
            }
        }
        return link.substring(0, colon).toLowerCase(Locale.ROOT);
    }
}
