package com.syncnest.identityservice.Validators;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.beans.BeanWrapperImpl;

import java.util.Objects;

public class PasswordMatchValidator implements ConstraintValidator<PasswordMatch, Object> {

    private String passwordField;
    private String passwordConfirmationField;
    private String message;

    @Override
    public void initialize(PasswordMatch constraint) {
        this.passwordField = constraint.passwordField();
        this.passwordConfirmationField = constraint.passwordConfirmationField();
        this.message = constraint.message();
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        if (value == null) return true;

        BeanWrapperImpl wrapper = new BeanWrapperImpl(value);
        Object password = wrapper.getPropertyValue(passwordField);
        Object confirmation = wrapper.getPropertyValue(passwordConfirmationField);

        // Blank fields are reported by @NotBlank
        if (password == null || confirmation == null) return true;

        if (Objects.equals(password, confirmation)) return true;

        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(message)
                .addPropertyNode(passwordConfirmationField)
                .addConstraintViolation();
        return false;
    }
}
