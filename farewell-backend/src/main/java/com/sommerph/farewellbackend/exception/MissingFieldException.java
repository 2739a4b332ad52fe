package com.sommerph.farewellbackend.exception;

import lombok.Getter;

@Getter
public class MissingFieldException extends ClaimProcessingException {

    private final String field;

    public MissingFieldException(String field, String context) {
        super(ErrorType.MISSING_FIELD, "Missing required field '" + field + "' in " + context);
        this.field = field;
    }

}
