package com.familyledger.ingestion.normalizer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Set;

/**
 * Coerce-or-default conversions for raw ledger cells. Dates fall back to null, numbers to zero; neither ever throws.
 */
public final class CellCoercion {

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("uuuu/M/d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT)
    );

    private static final Set<String> NON_FINITE = Set.of("nan", "inf", "+inf", "-inf", "infinity", "+infinity", "-infinity");

    private CellCoercion() {
    }

    /**
     * @return the parsed date, or null for blank, numeric or unrecognised input
     */
    public static LocalDate toDate(Object cell) {
        if (cell instanceof LocalDate d) {
            return d;
        }
        if (cell instanceof LocalDateTime dt) {
            return dt.toLocalDate();
        }
        if (!(cell instanceof CharSequence)) {
            return null;
        }
        String text = cell.toString().strip();
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate parsed = parseDate(text, format);
            if (parsed != null) {
                return parsed;
            }
        }
        return parseDateTime(text);
    }

    /**
     * @return the numeric value, or zero for blank, non-finite, non-numeric or out-of-double-range input
     */
    public static BigDecimal toAmount(Object cell) {
        if (cell == null) {
            return BigDecimal.ZERO;
        }
        if (cell instanceof BigDecimal d) {
            return bounded(d);
        }
        if (cell instanceof Number n) {
            return fromNumber(n);
        }
        String text = cell.toString().strip();
        if (text.isEmpty() || NON_FINITE.contains(text.toLowerCase())) {
            return BigDecimal.ZERO;
        }
        try {
            return bounded(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    public static String toText(Object cell) {
        return cell == null ? "" : cell.toString();
    }

    private static BigDecimal fromNumber(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double v = n.doubleValue();
            return Double.isFinite(v) ? BigDecimal.valueOf(v) : BigDecimal.ZERO;
        }
        try {
            return bounded(new BigDecimal(n.toString()));
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /** Zero for values outside double range: overflow, or a non-zero value that underflows. */
    private static BigDecimal bounded(BigDecimal value) {
        if (value.signum() == 0) {
            return value;
        }
        double approx = value.doubleValue();
        if (Double.isInfinite(approx) || approx == 0.0d) {
            return BigDecimal.ZERO;
        }
        return value;
    }

    private static LocalDate parseDate(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate parseDateTime(String text) {
        try {
            return LocalDateTime.parse(text.replace(' ', 'T')).toLocalDate();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toLocalDate();
            } catch (DateTimeParseException notOffset) {
                return null;
            }
        }
    }
}
