package com.sommerph.farewellbackend.exception;

public class KeyLengthMismatchException extends ClaimProcessingException {

    public KeyLengthMismatchException(String message) {
        super(ErrorType.KEY_LENGTH_MISMATCH, message);
    }

    public KeyLengthMismatchException(String message, Throwable cause) {
        super(ErrorType.KEY_LENGTH_MISMATCH, message, cause);
    }

}
