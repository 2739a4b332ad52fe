package com.sommerph.farewellbackend.model.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Envelope submitted on-chain to prove delivery of a message: one {@link RecipientProof} per
 * recipient, in the order of the original recipient list.
 */
public record DeliveryProof(
        @JsonProperty("type") String type,
        @JsonProperty("version") int version,
        @JsonProperty("owner") String owner,
        @JsonProperty("messageIndex") long messageIndex,
        @JsonProperty("recipientProofs") List<RecipientProof> recipientProofs,
        @JsonProperty("metadata") ProofMetadata metadata
) {

    public static final String TYPE = "farewell-delivery-proof";
    public static final int VERSION = 1;

    public DeliveryProof {
        recipientProofs = List.copyOf(recipientProofs);
    }

}
