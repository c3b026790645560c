package com.familyledger.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One history row. type is the label as written in the ledger, known or not.
 */
public record TransactionItemResponse(
        LocalDate date,
        String type,
        String description,
        BigDecimal amount,
        BigDecimal goldGrams,
        String amountDisplay,
        String goldGramsDisplay
) {
}
