package com.webprobe.scanner.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Результат обхода: страницы (отсортированы), формы, параметризованные URL
 * и адреса, которые не удалось загрузить после всех повторов.
 */
@Value
@Builder
public class CrawlResult {
    @Builder.Default
    List<String> pages = List.of();
    @Builder.Default
    List<Form> forms = List.of();
    @Builder.Default
    List<ParameterizedUrl> params = List.of();
    @Builder.Default
    List<String> unreachable = List.of();
    @Builder.Default
    boolean cancelled = false;

    public static CrawlResult empty() {
        return CrawlResult.builder().build();
    }
}
