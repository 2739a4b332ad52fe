package com.sommerph.farewellbackend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.sommerph.farewellbackend.exception.ValidationFailedException;
import com.sommerph.farewellbackend.model.claim.MessageData;
import com.sommerph.farewellbackend.model.proof.DeliveryProof;
import com.sommerph.farewellbackend.model.proof.ProofVerdict;
import com.sommerph.farewellbackend.repository.deliveryProof.DeliveryProofRegistry;
import com.sommerph.farewellbackend.service.claim.ClaimPackageParserService;
import com.sommerph.farewellbackend.service.proof.DeliveryProofValidationService;
import com.sommerph.farewellbackend.service.proof.ProofAssemblyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryProofService {

    private final ClaimPackageParserService claimPackageParserService;
    private final ProofAssemblyService proofAssemblyService;
    private final DeliveryProofValidationService validationService;
    private final DeliveryProofRegistry deliveryProofRegistry;

    public DeliveryProof prepareDeliveryProof(String owner, long messageIndex, JsonNode claim,
                                              Optional<String> secret, List<String> sentMessages) {
        log.info("Prepare delivery proof for owner {} message {}", owner, messageIndex);
        MessageData message = claimPackageParserService.parse(claim, secret);
        DeliveryProof proof = proofAssemblyService.assemble(owner, messageIndex, message, sentMessages);
        return store(proof);
    }

    public DeliveryProof store(DeliveryProof proof) {
        ProofVerdict verdict = validationService.validate(proof);
        if (!verdict.valid()) {
            throw new ValidationFailedException(verdict.message());
        }
        deliveryProofRegistry.save(proof);
        return proof;
    }

    public Optional<DeliveryProof> loadDeliveryProof(String owner, long messageIndex) {
        log.info("Load delivery proof for owner {} message {}", owner, messageIndex);
        if (!deliveryProofRegistry.exists(owner, messageIndex)) {
            return Optional.empty();
        }
        return Optional.ofNullable(deliveryProofRegistry.load(owner, messageIndex));
    }

}
