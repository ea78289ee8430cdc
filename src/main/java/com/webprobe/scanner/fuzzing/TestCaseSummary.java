package com.webprobe.scanner.fuzzing;

import com.webprobe.scanner.models.TestCase;
import com.webprobe.scanner.models.TestOrigin;
import lombok.Builder;
import lombok.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Статистика по набору тест-кейсов: по категориям, по источнику и число lab-only.
 */
@Value
@Builder
public class TestCaseSummary {
    int total;
    Map<String, Integer> byCategory;
    Map<String, Integer> byOrigin;
    int labOnly;

    public static TestCaseSummary of(Collection<TestCase> cases) {
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        Map<String, Integer> byOrigin = new LinkedHashMap<>();
        for (TestOrigin origin : TestOrigin.values()) {
            byOrigin.put(origin.getId(), 0);
        }
        int labOnly = 0;
        int total = 0;
        if (cases != null) {
            for (TestCase testCase : cases) {
                total++;
                byCategory.merge(testCase.getCategory(), 1, Integer::sum);
                if (testCase.getOrigin() != null) {
                    byOrigin.merge(testCase.getOrigin().getId(), 1, Integer::sum);
                }
                if (testCase.isLabOnly()) {
                    labOnly++;
                }
            }
        }
        return TestCaseSummary.builder()
            .total(total)
            .byCategory(Collections.unmodifiableMap(byCategory))
            .byOrigin(Collections.unmodifiableMap(byOrigin))
            .labOnly(labOnly)
            .build();
    }
}
