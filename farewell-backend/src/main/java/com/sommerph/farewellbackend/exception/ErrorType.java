package com.sommerph.farewellbackend.exception;

public enum ErrorType {
    MISSING_FIELD,
    MALFORMED_INPUT,
    KEY_LENGTH_MISMATCH,
    MALFORMED_PAYLOAD,
    DECRYPTION_AUTH_FAILURE,
    ENCODING_ERROR,
    RECIPIENT_COUNT_MISMATCH,
    VALIDATION_FAILURE
}
