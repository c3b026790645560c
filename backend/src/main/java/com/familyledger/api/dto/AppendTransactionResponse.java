package com.familyledger.api.dto;

/**
 * Outcome of POST /api/v1/transactions. type and formattedAmount are null unless status is ACCEPTED.
 */
public record AppendTransactionResponse(
        String status,
        String type,
        String formattedAmount,
        String message
) {
}
