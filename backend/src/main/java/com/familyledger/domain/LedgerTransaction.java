package com.familyledger.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * One cleansed ledger entry. At most one of the four bucket amounts is non-zero and which one is decided
 * by {@link #type()} alone; a row whose raw type is not a known label has all four buckets at zero.
 *
 * @param date                  transaction date, null when the source cell could not be parsed
 * @param rawType               type cell as found in the source, kept even when it is not a known label
 * @param type                  parsed type, null for unknown labels
 * @param description           free text, never null
 * @param amount                currency amount, zero when the source cell could not be parsed
 * @param goldGrams             gold weight, zero when the source cell could not be parsed
 */
public record LedgerTransaction(
        LocalDate date,
        String rawType,
        TransactionType type,
        String description,
        BigDecimal amount,
        BigDecimal goldGrams,
        BigDecimal incomeAmount,
        BigDecimal expenseAmount,
        BigDecimal stockInvestmentAmount,
        BigDecimal goldPurchaseAmount
) {

    public LedgerTransaction {
        rawType = rawType == null ? "" : rawType;
        description = description == null ? "" : description;
        amount = Objects.requireNonNullElse(amount, BigDecimal.ZERO);
        goldGrams = Objects.requireNonNullElse(goldGrams, BigDecimal.ZERO);
        incomeAmount = Objects.requireNonNullElse(incomeAmount, BigDecimal.ZERO);
        expenseAmount = Objects.requireNonNullElse(expenseAmount, BigDecimal.ZERO);
        stockInvestmentAmount = Objects.requireNonNullElse(stockInvestmentAmount, BigDecimal.ZERO);
        goldPurchaseAmount = Objects.requireNonNullElse(goldPurchaseAmount, BigDecimal.ZERO);
    }

    public boolean hasDate() {
        return date != null;
    }

    public Optional<TransactionType> knownType() {
        return Optional.ofNullable(type);
    }

    /** Income minus daily expense for this row; the step of the cumulative cash-flow trend. */
    public BigDecimal netCashFlow() {
        return incomeAmount.subtract(expenseAmount);
    }
}
