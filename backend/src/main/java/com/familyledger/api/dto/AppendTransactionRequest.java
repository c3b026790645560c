package com.familyledger.api.dto;

import com.familyledger.api.validation.KnownTransactionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * POST /api/v1/transactions request body. Missing date = today; missing amount or grams = 0.
 * goldGrams is ignored unless type is GoldPurchase.
 */
public record AppendTransactionRequest(
        LocalDate date,

        @NotBlank(message = "INVALID_TRANSACTION_TYPE")
        @KnownTransactionType
        String type,

        String description,

        @PositiveOrZero(message = "INVALID_AMOUNT")
        BigDecimal amount,

        @PositiveOrZero(message = "INVALID_GOLD_GRAMS")
        BigDecimal goldGrams
) {
}
