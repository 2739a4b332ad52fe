package com.sommerph.farewellbackend.exception;

/** Raised only when a caller insists on persisting or submitting an envelope that failed validation. */
public class ValidationFailedException extends ClaimProcessingException {

    public ValidationFailedException(String diagnostic) {
        super(ErrorType.VALIDATION_FAILURE, "Delivery proof failed validation: " + diagnostic);
    }

}
