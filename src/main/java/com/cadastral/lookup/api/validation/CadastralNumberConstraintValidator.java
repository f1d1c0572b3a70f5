package com.cadastral.lookup.api.validation;

import com.cadastral.lookup.domain.service.CadastralNumberValidator;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class CadastralNumberConstraintValidator implements ConstraintValidator<ValidCadastralNumber, String> {

    private final CadastralNumberValidator cadastralNumberValidator = new CadastralNumberValidator();

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || cadastralNumberValidator.isValid(value);
    }
}
