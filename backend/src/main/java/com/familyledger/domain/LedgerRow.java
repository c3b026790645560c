package com.familyledger.domain;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * One positional row ready for the store: ISO-8601 date, type label, description, amount, gold grams.
 */
public record LedgerRow(
        String isoDate,
        String type,
        String description,
        BigDecimal amount,
        BigDecimal goldGrams
) {

    public static LedgerRow fromDraft(TransactionDraft draft) {
        return new LedgerRow(
                draft.date() != null ? draft.date().format(DateTimeFormatter.ISO_LOCAL_DATE) : "",
                draft.type() != null ? draft.type().getLabel() : "",
                draft.description(),
                draft.amount(),
                draft.goldGrams());
    }

    /** Cells in column order. */
    public List<Object> cells() {
        return Arrays.asList(isoDate, type, description, amount, goldGrams);
    }
}
