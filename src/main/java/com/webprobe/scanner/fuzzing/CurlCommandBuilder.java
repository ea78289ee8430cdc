package com.webprobe.scanner.fuzzing;

import com.webprobe.scanner.config.HttpClientFactory;
import com.webprobe.scanner.models.TestCase;
import okhttp3.FormBody;
import okio.Buffer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Команда curl, воспроизводящая тест-кейс ровно так, как его отправляет движок.
 */
public final class CurlCommandBuilder {

    public static final String DEFAULT_PLACEHOLDER = "test_value";

    private CurlCommandBuilder() {
    }

    public static String build(TestCase testCase) {
        return build(testCase, DEFAULT_PLACEHOLDER);
    }

    public static String build(TestCase testCase, String placeholder) {
        List<String> parts = new ArrayList<>();
        parts.add("curl");
        parts.add("-s");
        parts.add("-L");

        String method = testCase.getMethod() != null ? testCase.getMethod().toUpperCase(Locale.ROOT) : "GET";
        String url = testCase.getUrl();
        if ("POST".equals(method)) {
            parts.add("-X");
            parts.add("POST");
            parts.add("-d");
            parts.add(quote(encodeForm(TestUrlBuilder.formFields(testCase, placeholder))));
        } else if (testCase.hasFormContext()) {
            url = TestUrlBuilder.mergeQuery(url, TestUrlBuilder.formFields(testCase, placeholder));
        }

        parts.add("-H");
        parts.add(quote("User-Agent: " + HttpClientFactory.USER_AGENT));
        parts.add("-H");
        parts.add(quote("Accept: " + HttpClientFactory.ACCEPT));
        parts.add(quote(url));
        return String.join(" ", parts);
    }

    /**
     * Тело application/x-www-form-urlencoded в той же кодировке, что и у OkHttp.
     */
    static String encodeForm(Map<String, String> fields) {
        FormBody.Builder body = new FormBody.Builder();
        fields.forEach((name, value) -> body.add(name, value != null ? value : ""));
        Buffer buffer = new Buffer();
        try {
            body.build().writeTo(buffer);
        } catch (IOException e) {
            throw new IllegalStateException("Запись в буфер в памяти не удалась", e);
        }
        return buffer.readUtf8();
    }

    /**
     * Одинарные кавычки для POSIX shell.
     */
    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
