package com.webprobe.scanner.fuzzing;

import java.util.List;
import java.util.Locale;

/**
 * Похож ли параметр на числовой идентификатор (подстрока без учета регистра).
 */
public final class NumericParamHeuristics {

    public static final List<String> INDICATORS = List.of(
        "id", "page", "offset", "limit", "count", "num", "index",
        "user_id", "item_id", "product_id", "order_id"
    );

    private NumericParamHeuristics() {
    }

    public static boolean looksNumeric(String paramName) {
        if (paramName == null || paramName.isBlank()) {
            return false;
        }
        String lower = paramName.toLowerCase(Locale.ROOT);
        for (String indicator : INDICATORS) {
            if (lower.contains(indicator)) {
                return true;
            }
        }
        return false;
    }
}
