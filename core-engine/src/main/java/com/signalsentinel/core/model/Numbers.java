package com.signalsentinel.core.model;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Display formatting for metric values embedded in alert text.
 *
 * @since 1.0.0
 */
public final class Numbers {

    private Numbers() {
        // utility class
    }

    /**
     * Shortest plain rendering: {@code 80.0 -> "80"}, {@code 8.50 -> "8.5"}.
     */
    public static String plain(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Fixed number of fraction digits, {@link Locale#ROOT} separators.
     */
    public static String fixed(double value, int fractionDigits) {
        return String.format(Locale.ROOT, "%." + fractionDigits + "f", value);
    }
}
