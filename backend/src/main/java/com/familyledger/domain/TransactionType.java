package com.familyledger.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of ledger transaction categories. The label is the exact cell text stored in the ledger.
 */
public enum TransactionType {
    INCOME("Income"),
    DAILY_EXPENSE("DailyExpense"),
    STOCK_SAVINGS("StockSavings"),
    GOLD_PURCHASE("GoldPurchase");

    private final String label;

    TransactionType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Exact, case-sensitive label match. Whitespace is not trimmed: "Income " is not a known type.
     */
    public static Optional<TransactionType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.label.equals(label))
                .findFirst();
    }
}
