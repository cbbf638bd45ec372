package com.escrowswap.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Jakarta Bean Validation side of {@link EvmAddress}; delegates to AddressValidator.
 */
@Component
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    private final AddressValidator addressValidator;

    public EvmAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || value.isBlank() || addressValidator.isValidAddress(value);
    }
}
