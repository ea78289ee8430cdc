package com.webprobe.scanner.payload;

import com.webprobe.scanner.config.ConfigurationException;

import java.util.Locale;

/**
 * Профиль набора полезных нагрузок.
 * SAFE - без разрушительных категорий, LAB и ALL - полный каталог.
 * lab-only кейсы исполняются только при LAB; ALL их генерирует, но отбор их отбрасывает.
 */
public enum PayloadProfile {
    SAFE,
    LAB,
    ALL;

    public static PayloadProfile parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Профиль нагрузок не указан. Используйте safe, lab или all");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "safe" -> SAFE;
            case "lab" -> LAB;
            case "all" -> ALL;
            default -> throw new ConfigurationException(
                "Неизвестный профиль: " + value + ". Используйте safe, lab или all");
        };
    }

    /**
     * Явно запрошены ли lab-only проверки.
     */
    public boolean allowsLabOnly() {
        return this == LAB;
    }
}
