package com.familyledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Indonesian Rupiah display: "Rp 5.000.000" (dot as thousands separator, no decimals, half-even rounding).
 */
public final class RupiahFormatter {

    private static final String ZERO = "Rp 0";

    private RupiahFormatter() {
    }

    public static String format(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        String grouped = String.format(Locale.ROOT, "%,d", amount.setScale(0, RoundingMode.HALF_EVEN).toBigInteger());
        return "Rp " + grouped.replace(',', '.');
    }

    /**
     * Gold weight with two decimals and comma grouping, e.g. "1,234.50".
     */
    public static String formatGrams(BigDecimal grams) {
        BigDecimal value = grams == null ? BigDecimal.ZERO : grams;
        return String.format(Locale.ROOT, "%,.2f", value.setScale(2, RoundingMode.HALF_EVEN));
    }
}
