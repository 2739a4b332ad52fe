package com.sommerph.farewellbackend.exception;

import lombok.Getter;

@Getter
public class RecipientCountMismatchException extends ClaimProcessingException {

    private final int expected;
    private final int actual;

    public RecipientCountMismatchException(String what, int expected, int actual) {
        super(ErrorType.RECIPIENT_COUNT_MISMATCH,
                "Recipient count mismatch: expected " + expected + " " + what + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

}
