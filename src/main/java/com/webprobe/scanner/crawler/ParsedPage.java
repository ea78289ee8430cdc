package com.webprobe.scanner.crawler;

import com.webprobe.scanner.models.Form;
import com.webprobe.scanner.models.ParameterizedUrl;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Что удалось извлечь из одной страницы.
 */
@Value
@Builder
public class ParsedPage {
    @Builder.Default
    List<String> links = List.of();
    @Builder.Default
    List<Form> forms = List.of();
    @Builder.Default
    List<ParameterizedUrl> params = List.of();
}
