package com.webprobe.scanner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Конфигурация сканера из YAML файла.
 * Значения по умолчанию подставляются в ensureDefaults(), поэтому
 * пустой или частичный файл тоже корректен.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScannerConfig {

    public static final String RESOURCE_NAME = "scanner-config.yaml";

    private Crawler crawler;
    private Fuzzing fuzzing;
    private Execution execution;
    private Classifier classifier;

    private static ScannerConfig instance;

    /**
     * Загрузить конфигурацию из classpath (кэшируется).
     */
    public static synchronized ScannerConfig load() {
        if (instance == null) {
            try (InputStream is = ScannerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (is == null) {
                    log.warn("{} не найден в classpath, используются значения по умолчанию", RESOURCE_NAME);
                    instance = defaults();
                } else {
                    instance = read(is);
                }
            } catch (IOException e) {
                throw new ConfigurationException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из файла (опция --config).
     */
    public static ScannerConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Файл конфигурации не найден: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        } catch (IOException e) {
            throw new ConfigurationException("Ошибка чтения " + path + ": " + e.getMessage(), e);
        }
    }

    public static ScannerConfig defaults() {
        ScannerConfig config = new ScannerConfig();
        config.ensureDefaults();
        return config;
    }

    static ScannerConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        JsonNode tree = mapper.readTree(is);
        ScannerConfig config = tree == null || tree.isMissingNode() || tree.isNull()
            ? new ScannerConfig()
            : mapper.treeToValue(tree, ScannerConfig.class);
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (crawler == null) {
            crawler = new Crawler();
        }
        crawler.ensureDefaults();
        if (fuzzing == null) {
            fuzzing = new Fuzzing();
        }
        fuzzing.ensureDefaults();
        if (execution == null) {
            execution = new Execution();
        }
        execution.ensureDefaults();
        if (classifier == null) {
            classifier = new Classifier();
        }
        classifier.ensureDefaults();
    }

    @Data
    public static class Crawler {
        private static final int DEFAULT_MAX_DEPTH = 2;
        private static final int DEFAULT_CONCURRENCY = 5;
        private static final long DEFAULT_DELAY_MS = 200L;
        private static final int DEFAULT_TIMEOUT_SEC = 10;
        private static final int DEFAULT_MAX_RETRIES = 2;

        private Integer maxDepth;
        private Integer concurrency;
        private Long delayMs;
        private Integer timeoutSec;
        private Integer maxRetries;

        public void ensureDefaults() {
            if (maxDepth == null || maxDepth < 0) {
                maxDepth = DEFAULT_MAX_DEPTH;
            }
            if (concurrency == null || concurrency < 1) {
                concurrency = DEFAULT_CONCURRENCY;
            }
            if (delayMs == null || delayMs < 0) {
                delayMs = DEFAULT_DELAY_MS;
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = DEFAULT_TIMEOUT_SEC;
            }
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = DEFAULT_MAX_RETRIES;
            }
        }
    }

    @Data
    public static class Fuzzing {
        private static final String DEFAULT_PROFILE = "safe";
        private static final int DEFAULT_MAX_PER_FIELD = 2;
        private static final int DEFAULT_MAX_TESTS = 200;

        private String profile;
        private Integer maxPerField;
        private Integer maxTests;

        public void ensureDefaults() {
            if (profile == null || profile.isBlank()) {
                profile = DEFAULT_PROFILE;
            }
            if (maxPerField == null || maxPerField < 1) {
                maxPerField = DEFAULT_MAX_PER_FIELD;
            }
            if (maxTests == null || maxTests < 1) {
                maxTests = DEFAULT_MAX_TESTS;
            }
        }
    }

    /**
     * Исполнение тест-кейсов. Параллельность и таймаут общие с секцией crawler.
     */
    @Data
    public static class Execution {
        private static final String DEFAULT_PLACEHOLDER = "test_value";

        private String placeholderValue;

        public void ensureDefaults() {
            if (placeholderValue == null) {
                placeholderValue = DEFAULT_PLACEHOLDER;
            }
        }
    }

    @Data
    public static class Classifier {
        private static final int DEFAULT_EVIDENCE_MAX_LENGTH = 500;
        private static final int DEFAULT_EVIDENCE_MARGIN = 100;
        private static final double DEFAULT_SLOW_RESPONSE_SECONDS = 10.0;

        private Integer evidenceMaxLength;
        private Integer evidenceMargin;
        private Double slowResponseSeconds;

        public void ensureDefaults() {
            if (evidenceMaxLength == null || evidenceMaxLength < 16) {
                evidenceMaxLength = DEFAULT_EVIDENCE_MAX_LENGTH;
            }
            if (evidenceMargin == null || evidenceMargin < 0) {
                evidenceMargin = DEFAULT_EVIDENCE_MARGIN;
            }
            if (slowResponseSeconds == null || slowResponseSeconds <= 0) {
                slowResponseSeconds = DEFAULT_SLOW_RESPONSE_SECONDS;
            }
        }
    }
}
