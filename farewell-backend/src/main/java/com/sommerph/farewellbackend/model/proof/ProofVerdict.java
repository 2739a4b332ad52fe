package com.sommerph.farewellbackend.model.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProofVerdict(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("message") String message
) {

    public static ProofVerdict pass() {
        return new ProofVerdict(true, "");
    }

    public static ProofVerdict fail(String message) {
        return new ProofVerdict(false, message);
    }

}
