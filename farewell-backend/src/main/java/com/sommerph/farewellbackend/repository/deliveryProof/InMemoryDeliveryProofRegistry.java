package com.sommerph.farewellbackend.repository.deliveryProof;

import com.sommerph.farewellbackend.model.proof.DeliveryProof;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryDeliveryProofRegistry implements DeliveryProofRegistry {

    private final Map<String, DeliveryProof> proofStore = new ConcurrentHashMap<>();

    @Override
    public void save(DeliveryProof proof) {
        log.info("Save delivery proof for owner {} message {}", proof.owner(), proof.messageIndex());
        proofStore.put(key(proof.owner(), proof.messageIndex()), proof);
    }

    @Override
    public DeliveryProof load(String owner, long messageIndex) {
        log.info("Load delivery proof for owner {} message {}", owner, messageIndex);
        return proofStore.get(key(owner, messageIndex));
    }

    @Override
    public boolean exists(String owner, long messageIndex) {
        return proofStore.containsKey(key(owner, messageIndex));
    }

    private static String key(String owner, long messageIndex) {
        return owner.toLowerCase(Locale.ROOT) + "#" + messageIndex;
    }

}
