package com.familyledger.api.dto;

import java.time.Instant;

/**
 * Error response body: error (code), message, timestamp (ISO 8601).
 * <p>
 * Codes: {@code INVALID_TRANSACTION_TYPE}, {@code INVALID_AMOUNT}, {@code INVALID_GOLD_GRAMS} and
 * {@code VALIDATION_ERROR} for field validation, {@code INVALID_REQUEST} for unreadable bodies (all 400);
 * {@code LEDGER_UNAVAILABLE} (503) when the store cannot be opened or authorised.
 * Rejected and failed appends answer with {@link AppendTransactionResponse} instead.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
