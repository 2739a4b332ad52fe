package com.sommerph.farewellbackend.repository.deliveryProof;

import com.sommerph.farewellbackend.model.proof.DeliveryProof;
import com.sommerph.farewellbackend.model.proof.ProofMetadata;
import com.sommerph.farewellbackend.model.proof.RecipientProof;

import java.util.List;

final class DeliveryProofFixtures {

    private DeliveryProofFixtures() {}

    static DeliveryProof deliveryProof(String owner, long messageIndex) {
        RecipientProof recipient = new RecipientProof(
                0,
                "0x" + "11".repeat(32),
                List.of("1", "2"),
                List.of(List.of("3", "4"), List.of("5", "6")),
                List.of("7", "8"),
                List.of("0x" + "11".repeat(32), "0x0", "0x" + "ab".repeat(32)));
        return new DeliveryProof(DeliveryProof.TYPE, DeliveryProof.VERSION, owner, messageIndex,
                List.of(recipient), new ProofMetadata("2026-01-01T00:00:00Z", 1, "test"));
    }

}
