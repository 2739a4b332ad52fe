package com.sommerph.farewellbackend.exception;

public class MalformedPayloadException extends ClaimProcessingException {

    public MalformedPayloadException(String message) {
        super(ErrorType.MALFORMED_PAYLOAD, message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(ErrorType.MALFORMED_PAYLOAD, message, cause);
    }

}
