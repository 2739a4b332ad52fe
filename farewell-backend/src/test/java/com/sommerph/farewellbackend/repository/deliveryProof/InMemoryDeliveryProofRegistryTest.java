package com.sommerph.farewellbackend.repository.deliveryProof;

import com.sommerph.farewellbackend.model.proof.DeliveryProof;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDeliveryProofRegistryTest {

    private final InMemoryDeliveryProofRegistry registry = new InMemoryDeliveryProofRegistry();

    @Test
    void proofsAreKeyedByOwnerAndMessageIndex() {
        DeliveryProof first = DeliveryProofFixtures.deliveryProof("0xABC", 0);
        DeliveryProof second = DeliveryProofFixtures.deliveryProof("0xabc", 1);

        registry.save(first);
        registry.save(second);

        assertSame(first, registry.load("0xabc", 0));
        assertSame(second, registry.load("0xABC", 1));
        assertFalse(registry.exists("0xabc", 2));
    }

}
