package com.familyledger.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * One of the four ledger labels: Income, DailyExpense, StockSavings, GoldPurchase (case-sensitive).
 * Null passes; combine with @NotBlank. Error code for API: INVALID_TRANSACTION_TYPE.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = KnownTransactionTypeValidator.class)
public @interface KnownTransactionType {

    String message() default "INVALID_TRANSACTION_TYPE";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
