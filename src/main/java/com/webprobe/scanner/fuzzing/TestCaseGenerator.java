package com.webprobe.scanner.fuzzing;

import com.webprobe.scanner.config.ConfigurationException;
import com.webprobe.scanner.models.Form;
import com.webprobe.scanner.models.ParameterizedUrl;
import com.webprobe.scanner.models.TestCase;
import com.webprobe.scanner.models.TestOrigin;
import com.webprobe.scanner.payload.Payload;
import com.webprobe.scanner.payload.PayloadCatalog;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Генерация тест-кейсов по найденным параметрам и формам.
 *
 * <p>Результат - ленивый одноразовый Stream. Генератор ничего не фильтрует:
 * lab-only кейсы помечаются, но отбрасывает их вызывающий код.</p>
 */
@Slf4j
public class TestCaseGenerator {

    private final Supplier<String> idSupplier;

    public TestCaseGenerator() {
        this(() -> UUID.randomUUID().toString());
    }

    public TestCaseGenerator(Supplier<String> idSupplier) {
        this.idSupplier = Objects.requireNonNull(idSupplier, "idSupplier");
    }

    public Stream<TestCase> generate(List<ParameterizedUrl> params,
                                     List<Form> forms,
                                     PayloadCatalog catalog,
                                     int perFieldCap) {
        if (perFieldCap < 1) {
            throw new ConfigurationException("maxPerField должен быть >= 1: " + perFieldCap);
        }
        Objects.requireNonNull(catalog, "catalog");
        List<ParameterizedUrl> safeParams = params != null ? params : List.of();
        List<Form> safeForms = forms != null ? forms : List.of();
        log.debug("Генерация: URL с параметрами {}, форм {}, лимит на поле {}",
            safeParams.size(), safeForms.size(), perFieldCap);
        return Stream.concat(
            fromParams(safeParams, catalog, perFieldCap),
            fromForms(safeForms, catalog, perFieldCap));
    }

    public Stream<TestCase> fromParams(List<ParameterizedUrl> params, PayloadCatalog catalog, int perFieldCap) {
        return params.stream()
            .flatMap(target -> target.getParamNames().stream()
                .flatMap(param -> catalog.categories().stream()
                    .filter(category -> !PayloadCatalog.IDOR_NUMERIC.equals(category)
                        || NumericParamHeuristics.looksNumeric(param))
                    .flatMap(category -> catalog.payloads(category).stream()
                        .limit(perFieldCap)
                        .map(payload -> paramCase(target.getUrl(), param, category, payload))
                        .filter(Objects::nonNull))));
    }

    public Stream<TestCase> fromForms(List<Form> forms, PayloadCatalog catalog, int perFieldCap) {
        return forms.stream()
            .flatMap(form -> form.getInputNames().stream()
                .flatMap(input -> catalog.categories().stream()
                    .filter(category -> !PayloadCatalog.IDOR_NUMERIC.equals(category))
                    .flatMap(category -> catalog.payloads(category).stream()
                        .limit(perFieldCap)
                        .map(payload -> formCase(form, input, category, payload)))));
    }

    private TestCase paramCase(String url, String param, String category, Payload payload) {
        String value = TestUrlBuilder.injectedValue(payload, TestUrlBuilder.originalValue(url, param));
        String testUrl = TestUrlBuilder.withParam(url, param, value);
        if (testUrl == null) {
            log.debug("Пропуск {}: URL не разбирается", url);
            return null;
        }
        return TestCase.builder()
            .id(idSupplier.get())
            .method("GET")
            .url(testUrl)
            .targetParam(param)
            .payload(payload)
            .injectedValue(value)
            .origin(TestOrigin.PARAM)
            .category(category)
            .labOnly(PayloadCatalog.isLabOnly(category, payload))
            .build();
    }

    private TestCase formCase(Form form, String input, String category, Payload payload) {
        return TestCase.builder()
            .id(idSupplier.get())
            .method(form.getMethod().name())
            .url(form.getActionUrl())
            .targetParam(input)
            .payload(payload)
            .injectedValue(TestUrlBuilder.injectedValue(payload, null))
            .origin(TestOrigin.FORM)
            .category(category)
            .labOnly(PayloadCatalog.isLabOnly(category, payload))
            .formInputs(form.getInputNames())
            .build();
    }
}
