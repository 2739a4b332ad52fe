package com.sommerph.farewellbackend.exception;

public class DecryptionAuthFailureException extends ClaimProcessingException {

    public DecryptionAuthFailureException(String message) {
        super(ErrorType.DECRYPTION_AUTH_FAILURE, message);
    }

    public DecryptionAuthFailureException(String message, Throwable cause) {
        super(ErrorType.DECRYPTION_AUTH_FAILURE, message, cause);
    }

}
