package com.sommerph.farewellbackend.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.sommerph.farewellbackend.exception.ClaimProcessingException;
import com.sommerph.farewellbackend.model.proof.DeliveryProof;
import com.sommerph.farewellbackend.model.proof.ProofVerdict;
import com.sommerph.farewellbackend.service.DeliveryProofService;
import com.sommerph.farewellbackend.service.proof.DeliveryProofValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/proof/delivery")
@RequiredArgsConstructor
@Tag(name = "Delivery Proof", description = "Endpoints for assembling and validating delivery proofs")
public class DeliveryProofController {

    private final DeliveryProofService deliveryProofService;
    private final DeliveryProofValidationService validationService;

    @Operation(summary = "Assemble, validate and store the delivery proof for a sent message")
    @PostMapping
    public ResponseEntity<?> prepareDeliveryProof(@Valid @RequestBody DeliveryProofRequest request) {
        log.info("Prepare delivery proof for owner: {}, message index: {}", request.getOwner(), request.getMessageIndex());
        try {
            DeliveryProof proof = deliveryProofService.prepareDeliveryProof(
                    request.getOwner(),
                    request.getMessageIndex(),
                    request.getClaim(),
                    Optional.ofNullable(request.getSecret()),
                    request.getSentMessages());
            return ResponseEntity.ok(proof);
        } catch (ClaimProcessingException e) {
            log.error("Rejected delivery proof for owner: {} ({})", request.getOwner(), e.getErrorType(), e);
            return ResponseEntity.badRequest().body(e.getErrorType() + ": " + e.getMessage());
        } catch (Exception e) {
            log.error("Failed to prepare delivery proof for owner: {}", request.getOwner(), e);
            return ResponseEntity.internalServerError().body("Error preparing delivery proof: " + e.getMessage());
        }
    }

    @Operation(summary = "Get a stored delivery proof")
    @GetMapping("/{owner}/{messageIndex}")
    public ResponseEntity<?> getDeliveryProof(@PathVariable @NotBlank String owner,
                                              @PathVariable @Min(0) long messageIndex) {
        log.info("Load delivery proof for owner: {}, message index: {}", owner, messageIndex);
        try {
            return deliveryProofService.loadDeliveryProof(owner, messageIndex)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        } catch (ClaimProcessingException e) {
            log.error("Rejected delivery proof lookup for owner: {}", owner, e);
            return ResponseEntity.badRequest().body(e.getErrorType() + ": " + e.getMessage());
        }
    }

    @Operation(summary = "Validate the structure of a delivery proof")
    @PostMapping("/validate")
    public ResponseEntity<ProofVerdict> validate(@RequestBody JsonNode candidate) {
        log.info("Validate delivery proof");
        return ResponseEntity.ok(validationService.validate(candidate));
    }

    @Data
    public static class DeliveryProofRequest {
        @NotBlank
        private String owner;
        @Min(0)
        private long messageIndex;
        @NotNull
        private JsonNode claim;
        private String secret;
        @NotEmpty
        private List<String> sentMessages;
    }

}
