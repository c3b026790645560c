package com.familyledger.domain;

import java.util.List;

/**
 * Ordered, immutable sequence of ledger transactions in source row order (not date order).
 */
public record Ledger(List<LedgerTransaction> transactions) {

    private static final Ledger EMPTY = new Ledger(List.of());

    public Ledger {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public static Ledger empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }

    public int size() {
        return transactions.size();
    }
}
