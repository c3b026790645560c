package com.familyledger.ingestion.classifier;

import com.familyledger.domain.LedgerTransaction;
import com.familyledger.domain.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Derives the four mutually exclusive bucket amounts of a row from its type label.
 */
public final class TransactionBucketClassifier {

    private TransactionBucketClassifier() {
    }

    public static LedgerTransaction classify(LocalDate date, String rawType, String description,
                                             BigDecimal amount, BigDecimal goldGrams) {
        TransactionType type = TransactionType.fromLabel(rawType).orElse(null);
        BigDecimal zero = BigDecimal.ZERO;
        return new LedgerTransaction(
                date,
                rawType,
                type,
                description,
                amount,
                goldGrams,
                type == TransactionType.INCOME ? amount : zero,
                type == TransactionType.DAILY_EXPENSE ? amount : zero,
                type == TransactionType.STOCK_SAVINGS ? amount : zero,
                type == TransactionType.GOLD_PURCHASE ? amount : zero
        );
    }
}
