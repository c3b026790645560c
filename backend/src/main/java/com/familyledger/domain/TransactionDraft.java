package com.familyledger.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A proposed new ledger entry, as captured by the presentation layer. Same shape as
 * {@link LedgerTransaction} without the derived buckets.
 */
public record TransactionDraft(
        LocalDate date,
        TransactionType type,
        String description,
        BigDecimal amount,
        BigDecimal goldGrams
) {

    public TransactionDraft {
        description = description == null ? "" : description;
        amount = amount == null ? BigDecimal.ZERO : amount;
        goldGrams = goldGrams == null ? BigDecimal.ZERO : goldGrams;
    }

    /**
     * True when neither an amount nor a gold weight was entered. Such drafts are never written.
     */
    public boolean hasNoValue() {
        return amount.signum() == 0 && goldGrams.signum() == 0;
    }
}
