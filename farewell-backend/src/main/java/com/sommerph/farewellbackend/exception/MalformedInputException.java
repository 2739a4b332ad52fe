package com.sommerph.farewellbackend.exception;

public class MalformedInputException extends ClaimProcessingException {

    public MalformedInputException(String message) {
        super(ErrorType.MALFORMED_INPUT, message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(ErrorType.MALFORMED_INPUT, message, cause);
    }

}
