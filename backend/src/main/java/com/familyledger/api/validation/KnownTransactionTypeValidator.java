package com.familyledger.api.validation;

import com.familyledger.domain.TransactionType;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class KnownTransactionTypeValidator implements ConstraintValidator<KnownTransactionType, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        return TransactionType.fromLabel(value).isPresent();
    }
}
