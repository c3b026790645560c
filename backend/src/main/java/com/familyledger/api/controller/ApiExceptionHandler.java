package com.familyledger.api.controller;

import com.familyledger.api.dto.ErrorBody;
import com.familyledger.store.LedgerConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps validation failures (@Valid) and unreadable bodies to 400, and an unreachable ledger store to 503,
 * all with ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadableInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST",
                Optional.ofNullable(ex.getReason()).orElse("Malformed request body")));
    }

    @ExceptionHandler(LedgerConnectionException.class)
    public ResponseEntity<ErrorBody> handleConnection(LedgerConnectionException ex) {
        log.error("Ledger store unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("LEDGER_UNAVAILABLE", ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_TRANSACTION_TYPE" -> "Type must be one of Income, DailyExpense, StockSavings, GoldPurchase";
            case "INVALID_AMOUNT" -> "Amount must not be negative";
            case "INVALID_GOLD_GRAMS" -> "Gold weight must not be negative";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
