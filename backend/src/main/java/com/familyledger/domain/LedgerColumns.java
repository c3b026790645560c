package com.familyledger.domain;

import java.util.List;

/**
 * Header names of the five ledger columns, in the fixed storage order.
 */
public record LedgerColumns(
        String date,
        String type,
        String description,
        String amount,
        String goldGrams
) {

    public static final LedgerColumns DEFAULT =
            new LedgerColumns("Date", "TransactionType", "Description", "Amount", "GoldGrams");

    public List<String> inOrder() {
        return List.of(date, type, description, amount, goldGrams);
    }
}
