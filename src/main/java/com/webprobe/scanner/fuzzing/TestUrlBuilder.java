package com.webprobe.scanner.fuzzing;

import com.webprobe.scanner.models.TestCase;
import com.webprobe.scanner.payload.LiteralPayload;
import com.webprobe.scanner.payload.NumericDirective;
import com.webprobe.scanner.payload.Payload;
import okhttp3.HttpUrl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Построение URL и значений полей для тест-кейса.
 */
public final class TestUrlBuilder {

    /** Исходное значение, если параметра нет в URL вовсе. */
    static final String MISSING_VALUE_DEFAULT = "1";

    private TestUrlBuilder() {
    }

    /**
     * Подставить value в параметр param, сохранив схему, хост, путь,
     * остальные параметры и их порядок. Повторные вхождения param схлопываются
     * в одно на месте первого; если param не было, он добавляется в конец.
     *
     * @return новый URL или null, если url не разбирается
     */
    public static String withParam(String url, String param, String value) {
        HttpUrl parsed = url != null ? HttpUrl.parse(url) : null;
        if (parsed == null) {
            return null;
        }
        HttpUrl.Builder builder = parsed.newBuilder().query(null);
        boolean replaced = false;
        for (int i = 0; i < parsed.querySize(); i++) {
            String name = parsed.queryParameterName(i);
            if (name.equals(param)) {
                if (!replaced) {
                    builder.addQueryParameter(param, value);
                    replaced = true;
                }
            } else {
                builder.addQueryParameter(name, parsed.queryParameterValue(i));
            }
        }
        if (!replaced) {
            builder.addQueryParameter(param, value);
        }
        return builder.build().toString();
    }

    /**
     * Значение параметра в URL: null если параметра нет.
     */
    public static String originalValue(String url, String param) {
        HttpUrl parsed = url != null ? HttpUrl.parse(url) : null;
        if (parsed == null) {
            return null;
        }
        for (int i = 0; i < parsed.querySize(); i++) {
            if (parsed.queryParameterName(i).equals(param)) {
                String value = parsed.queryParameterValue(i);
                return value != null ? value : "";
            }
        }
        return null;
    }

    /**
     * Конкретная строка, которую нужно подставить в параметр.
     *
     * @param original текущее значение параметра, null если его нет
     */
    public static String injectedValue(Payload payload, String original) {
        if (payload instanceof NumericDirective directive) {
            if (directive.getKind() != NumericDirective.Kind.ADJACENT) {
                return Long.toString(directive.getAmount());
            }
            String base = original != null ? original : MISSING_VALUE_DEFAULT;
            try {
                return Long.toString(Math.addExact(Long.parseLong(base.trim()), directive.getAmount()));
            } catch (NumberFormatException | ArithmeticException e) {
                return Long.toString(directive.getAmount());
            }
        }
        if (payload instanceof LiteralPayload literal) {
            return literal.getValue();
        }
        return payload != null ? payload.describe() : "";
    }

    /**
     * Значения всех полей формы: целевое поле получает нагрузку, остальные - заглушку.
     * Без контекста формы - одно поле {targetParam: injectedValue}.
     */
    public static Map<String, String> formFields(TestCase testCase, String placeholder) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (testCase.hasFormContext()) {
            List<String> inputs = testCase.getFormInputs();
            for (String input : inputs) {
                fields.put(input, input.equals(testCase.getTargetParam()) ? testCase.getInjectedValue() : placeholder);
            }
            fields.putIfAbsent(testCase.getTargetParam(), testCase.getInjectedValue());
        } else {
            fields.put(testCase.getTargetParam(), testCase.getInjectedValue());
        }
        return fields;
    }

    /**
     * Отправка GET формы: поля дописываются в query string как это делает браузер.
     * Поля формы заменяют одноименные параметры action URL.
     */
    public static String mergeQuery(String url, Map<String, String> fields) {
        HttpUrl parsed = url != null ? HttpUrl.parse(url) : null;
        if (parsed == null) {
            return url;
        }
        HttpUrl.Builder builder = parsed.newBuilder();
        fields.forEach(builder::setQueryParameter);
        return builder.build().toString();
    }
}
