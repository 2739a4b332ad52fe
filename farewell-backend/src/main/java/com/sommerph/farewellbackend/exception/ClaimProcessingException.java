package com.sommerph.farewellbackend.exception;

import lombok.Getter;

/**
 * Base type for every failure that aborts processing of a single claim or delivery proof.
 * The message always names the offending field, recipient index or cipher check.
 */
@Getter
public abstract class ClaimProcessingException extends RuntimeException {

    private final ErrorType errorType;

    protected ClaimProcessingException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected ClaimProcessingException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

}
