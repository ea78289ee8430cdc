package com.webprobe.scanner.payload;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Директива подмены числового идентификатора.
 * Для ADJACENT amount - смещение относительно исходного значения,
 * для LARGE и NEGATIVE - готовое значение.
 */
@Value
@Builder
public class NumericDirective implements Payload {

    public enum Kind {
        ADJACENT,
        LARGE,
        NEGATIVE
    }

    Kind kind;
    long amount;
    String note;

    public static NumericDirective adjacent(long delta, String note) {
        return new NumericDirective(Kind.ADJACENT, delta, note);
    }

    public static NumericDirective fixed(Kind kind, long value, String note) {
        return new NumericDirective(kind, value, note);
    }

    @Override
    public String describe() {
        return kind == Kind.ADJACENT
            ? "adjacent(" + (amount >= 0 ? "+" : "") + amount + ")"
            : kind.name().toLowerCase(Locale.ROOT) + "(" + amount + ")";
    }
}
