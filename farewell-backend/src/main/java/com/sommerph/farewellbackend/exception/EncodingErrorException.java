package com.sommerph.farewellbackend.exception;

public class EncodingErrorException extends ClaimProcessingException {

    public EncodingErrorException(String message) {
        super(ErrorType.ENCODING_ERROR, message);
    }

    public EncodingErrorException(String message, Throwable cause) {
        super(ErrorType.ENCODING_ERROR, message, cause);
    }

}
