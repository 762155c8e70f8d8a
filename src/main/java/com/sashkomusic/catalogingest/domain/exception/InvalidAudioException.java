package com.sashkomusic.catalogingest.domain.exception;

import com.sashkomusic.catalogingest.domain.model.ValidationResult;

public class InvalidAudioException extends RuntimeException {

    private final ValidationResult validation;

    public InvalidAudioException(ValidationResult validation) {
        super(validation.getReason());
        this.validation = validation;
    }

    public ValidationResult getValidation() {
        return validation;
    }
}
