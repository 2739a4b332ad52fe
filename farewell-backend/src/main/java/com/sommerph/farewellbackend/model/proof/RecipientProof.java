package com.sommerph.farewellbackend.model.proof;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Groth16 proof data for a single recipient, in the layout expected by the on-chain verifier.
 * <p>
 * {@code pA} and {@code pC} hold two field elements, {@code pB} is a 2x2 matrix. The public signals
 * are {@code [recipientHash, dkimKeyHash, contentHash]}; their numeric meaning is owned by the
 * delivery circuit and is not interpreted here.
 */
public record RecipientProof(
        @JsonProperty("recipientIndex") int recipientIndex,
        @JsonProperty("recipientHash") String recipientHash,
        @JsonProperty("pA") List<String> pA,
        @JsonProperty("pB") List<List<String>> pB,
        @JsonProperty("pC") List<String> pC,
        @JsonProperty("publicSignals") List<String> publicSignals
) {

    public static final int SIGNAL_RECIPIENT_HASH = 0;
    public static final int SIGNAL_DKIM_KEY_HASH = 1;
    public static final int SIGNAL_CONTENT_HASH = 2;

    public RecipientProof {
        pA = List.copyOf(pA);
        pB = pB.stream().map(List::copyOf).toList();
        pC = List.copyOf(pC);
        publicSignals = List.copyOf(publicSignals);
    }

}
