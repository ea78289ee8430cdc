package com.webprobe.scanner.heuristics;

import com.webprobe.scanner.config.ConfigurationException;
import com.webprobe.scanner.config.ScannerConfig;
import com.webprobe.scanner.models.Finding;
import com.webprobe.scanner.models.FindingCategory;
import com.webprobe.scanner.models.ResponseRecord;
import com.webprobe.scanner.models.Severity;
import com.webprobe.scanner.models.TestCase;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Классификация ответа на тест-кейс.
 *
 * <p>Правила проверяются строго по приоритету, первое сработавшее определяет
 * категорию: xss, sqli, command_injection, info_disclosure, error, anomaly.
 * Состояния нет, экземпляр можно разделять между воркерами. classify()
 * никогда не бросает исключений.</p>
 */
@Slf4j
public class ResponseClassifier {

    public static final double DEFAULT_SLOW_RESPONSE_SECONDS = 10.0;

    private final Clock clock;
    private final EvidenceExtractor evidenceExtractor;
    private final double slowResponseSeconds;

    public ResponseClassifier() {
        this(Clock.systemUTC(), new EvidenceExtractor(), DEFAULT_SLOW_RESPONSE_SECONDS);
    }

    public ResponseClassifier(Clock clock, EvidenceExtractor evidenceExtractor, double slowResponseSeconds) {
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.evidenceExtractor = evidenceExtractor != null ? evidenceExtractor : new EvidenceExtractor();
        this.slowResponseSeconds = slowResponseSeconds > 0 ? slowResponseSeconds : DEFAULT_SLOW_RESPONSE_SECONDS;
    }

    /**
     * @throws ConfigurationException если настройки доказательств недопустимы
     */
    public static ResponseClassifier fromConfig(ScannerConfig.Classifier config, Clock clock) {
        if (config == null || config.getEvidenceMaxLength() == null || config.getEvidenceMargin() == null
            || config.getSlowResponseSeconds() == null) {
            throw new ConfigurationException("секция classifier не заполнена");
        }
        EvidenceExtractor extractor;
        try {
            extractor = new EvidenceExtractor(config.getEvidenceMaxLength(), config.getEvidenceMargin());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("classifier.evidenceMaxLength: " + e.getMessage(), e);
        }
        return new ResponseClassifier(clock, extractor, config.getSlowResponseSeconds());
    }

    public Optional<Finding> classify(TestCase testCase, ResponseRecord response) {
        if (testCase == null || response == null || !response.hasBody()) {
            return Optional.empty();
        }
        try {
            Verdict verdict = evaluate(testCase, response);
            if (verdict == null) {
                return Optional.empty();
            }
            return Optional.of(toFinding(testCase, response, verdict));
        } catch (RuntimeException e) {
            log.warn("Не удалось классифицировать ответ для {}: {}", testCase.getId(), e.toString());
            return Optional.empty();
        }
    }

    Verdict evaluate(TestCase testCase, ResponseRecord response) {
        String body = response.getBody();
        String lowerBody = body.toLowerCase(Locale.ROOT);
        String payload = testCase.getInjectedValue() != null ? testCase.getInjectedValue() : "";
        String lowerPayload = payload.toLowerCase(Locale.ROOT);
        boolean reflected = !lowerPayload.isEmpty() && lowerBody.contains(lowerPayload);

        if (DetectionRules.anyMatch(DetectionRules.XSS_PATTERNS, body)
                || (reflected && DetectionRules.containsAny(lowerPayload, DetectionRules.SCRIPT_PAYLOAD_MARKERS))) {
            return new Verdict(FindingCategory.XSS, Severity.HIGH);
        }

        boolean tautologyReflected = reflected
            && DetectionRules.containsAny(lowerPayload, DetectionRules.TAUTOLOGY_TOKENS);
        if (DetectionRules.containsAny(lowerBody, DetectionRules.DB_ERROR_KEYWORDS) || tautologyReflected) {
            Severity severity = DetectionRules.anyMatch(DetectionRules.DB_ENGINE_TOKENS, body)
                ? Severity.CRITICAL
                : Severity.HIGH;
            return new Verdict(FindingCategory.SQLI, severity);
        }

        if (DetectionRules.anyMatch(DetectionRules.COMMAND_OUTPUT_PATTERNS, body)) {
            return new Verdict(FindingCategory.COMMAND_INJECTION, Severity.HIGH);
        }

        boolean genericError = DetectionRules.containsAny(lowerBody, DetectionRules.GENERIC_ERROR_KEYWORDS);
        String server = response.header("Server");
        if (DetectionRules.anyMatch(DetectionRules.STACK_TRACE_PATTERNS, body)
                || (genericError && DetectionRules.mentionsServerProduct(server))) {
            return new Verdict(FindingCategory.INFO_DISCLOSURE, Severity.MEDIUM);
        }

        if (genericError) {
            return new Verdict(FindingCategory.ERROR, Severity.MEDIUM);
        }

        if (isAnomaly(response, server)) {
            return new Verdict(FindingCategory.ANOMALY, Severity.LOW);
        }
        return null;
    }

    private boolean isAnomaly(ResponseRecord response, String server) {
        if (DetectionRules.ANOMALY_STATUS_CODES.contains(response.getStatusCode())) {
            return true;
        }
        if (response.getElapsedSeconds() > slowResponseSeconds) {
            return true;
        }
        return server != null
            && DetectionRules.containsAny(server.toLowerCase(Locale.ROOT), DetectionRules.SUSPICIOUS_SERVER_MARKERS);
    }

    private Finding toFinding(TestCase testCase, ResponseRecord response, Verdict verdict) {
        String id = testCase.getId() != null ? testCase.getId() : UUID.randomUUID().toString();
        return Finding.builder()
            .id(id)
            .category(verdict.category())
            .severity(verdict.severity())
            .url(testCase.getUrl())
            .param(testCase.getTargetParam())
            .method(testCase.getMethod())
            .payload(testCase.getInjectedValue())
            .statusCode(response.getStatusCode())
            .evidence(evidenceExtractor.extract(response.getBody(), testCase.getInjectedValue()))
            .finalUrl(response.getFinalUrl())
            .responseTimeSeconds(response.getElapsedSeconds())
            .timestamp(Instant.now(clock))
            .build();
    }

    record Verdict(FindingCategory category, Severity severity) {
    }
}
