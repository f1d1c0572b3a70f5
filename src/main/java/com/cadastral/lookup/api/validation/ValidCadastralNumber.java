package com.cadastral.lookup.api.validation;

import com.cadastral.lookup.domain.service.CadastralNumberValidator;
import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotated string must follow the cadastral number grammar.
 * {@code null} is considered valid; combine with {@code @NotNull} where required.
 */
@Documented
@Constraint(validatedBy = CadastralNumberConstraintValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidCadastralNumber {

    String message() default CadastralNumberValidator.FORMAT_MESSAGE;

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
