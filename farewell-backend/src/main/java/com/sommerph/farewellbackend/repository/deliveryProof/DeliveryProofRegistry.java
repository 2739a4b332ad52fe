package com.sommerph.farewellbackend.repository.deliveryProof;

import com.sommerph.farewellbackend.model.proof.DeliveryProof;

/** Delivery proofs keyed by owner address and message index. */
public interface DeliveryProofRegistry {

    void save(DeliveryProof proof);

    DeliveryProof load(String owner, long messageIndex);

    boolean exists(String owner, long messageIndex);

}
