package com.sommerph.farewellbackend.model.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProofMetadata(
        @JsonProperty("createdAt") String createdAt,
        @JsonProperty("recipientCount") int recipientCount,
        @JsonProperty("generator") String generator
) {
}
