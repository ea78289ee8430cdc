package com.webprobe.scanner.heuristics;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Неизменяемые таблицы сигнатур для классификатора ответов.
 * Все проверки выполняются по тексту в нижнем регистре.
 */
public final class DetectionRules {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    public static final List<Pattern> XSS_PATTERNS = compile(
        "<script[^>]*>.*?</script>",
        "<img[^>]*onerror[^>]*>",
        "<svg[^>]*onload[^>]*>",
        "<iframe[^>]*src[^>]*javascript:",
        "<body[^>]*onload[^>]*>",
        "<input[^>]*onfocus[^>]*>",
        "<select[^>]*onfocus[^>]*>",
        "javascript:",
        "onclick\\s*=",
        "onmouseover\\s*=",
        "onerror\\s*=",
        "onload\\s*="
    );

    /** Признаки того, что нагрузка сама по себе похожа на скрипт. */
    public static final List<String> SCRIPT_PAYLOAD_MARKERS = List.of(
        "<script", "<img", "<svg", "<iframe", "<body", "<input", "<select",
        "javascript:", "onclick", "onmouseover", "onerror", "onload", "onfocus"
    );

    public static final List<String> DB_ERROR_KEYWORDS = List.of(
        "syntax error", "mysql", "ora-00933", "postgres", "sqlstate", "sql syntax",
        "database error", "sql error", "query failed", "mysql_fetch", "postgresql",
        "oracle", "sqlite", "mssql", "sql server", "access denied", "invalid query",
        "sql exception", "database connection", "sql command", "sqlite3", "mysqli",
        "pg_query", "oci_parse", "sqlite_error", "mssql_query"
    );

    /** Токены конкретной СУБД: поднимают sqli до CRITICAL. */
    public static final List<Pattern> DB_ENGINE_TOKENS = compile(
        "sqlstate",
        "ora-\\d{5}",
        "mysql_fetch",
        "pg_query",
        "mysqli",
        "sqlite_error",
        "oci_parse",
        "mssql_query",
        "unclosed quotation mark",
        "you have an error in your sql syntax"
    );

    public static final List<String> TAUTOLOGY_TOKENS = List.of(
        "' or '1'='1",
        "\" or \"1\"=\"1",
        " or 1=1"
    );

    public static final List<Pattern> COMMAND_OUTPUT_PATTERNS = compile(
        "command not found",
        "permission denied",
        "uid=\\d+\\(",
        "sh: \\d+:"
    );

    public static final List<Pattern> STACK_TRACE_PATTERNS = compile(
        "traceback \\(most recent call last\\)",
        "stack trace",
        "\\bat [\\w$.]+\\([\\w$]+\\.java:\\d+\\)",
        "exception in thread",
        "\\.php on line \\d+"
    );

    public static final Set<String> SERVER_PRODUCTS = Set.of(
        "apache", "nginx", "iis", "tomcat", "jetty", "gunicorn", "werkzeug", "express",
        "jboss", "weblogic", "websphere", "lighttpd", "openresty", "kestrel"
    );

    public static final List<String> GENERIC_ERROR_KEYWORDS = List.of(
        "error", "exception", "warning", "fatal", "critical", "failed", "failure",
        "invalid", "unauthorized", "forbidden", "not found", "internal server error",
        "bad request", "service unavailable", "timeout", "connection refused"
    );

    public static final Set<Integer> ANOMALY_STATUS_CODES = Set.of(500, 502, 503, 504);

    public static final List<String> SUSPICIOUS_SERVER_MARKERS = List.of("error", "debug", "test");

    private DetectionRules() {
    }

    public static boolean anyMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsAny(String lowerText, List<String> keywords) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static boolean mentionsServerProduct(String serverHeader) {
        if (serverHeader == null || serverHeader.isBlank()) {
            return false;
        }
        String lower = serverHeader.toLowerCase(Locale.ROOT);
        for (String product : SERVER_PRODUCTS) {
            if (lower.contains(product)) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        Pattern[] patterns = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) {
            patterns[i] = Pattern.compile(regexes[i], FLAGS);
        }
        return List.of(patterns);
    }
}
