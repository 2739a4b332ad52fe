package com.sommerph.farewellbackend.controller;

import com.sommerph.farewellbackend.exception.ClaimProcessingException;
import com.sommerph.farewellbackend.exception.MalformedInputException;
import com.sommerph.farewellbackend.model.claim.MessageData;
import com.sommerph.farewellbackend.service.claim.ClaimPackageParserService;
import com.sommerph.farewellbackend.service.claim.KeyReconstructionService;
import com.sommerph.farewellbackend.service.claim.PayloadDecryptionService;
import com.sommerph.farewellbackend.util.HexUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.security.SecureRandom;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/claim")
@RequiredArgsConstructor
@Tag(name = "Claim", description = "Endpoints for opening claim packages and direct messages")
public class ClaimController {

    public static final String SECRET_HEADER = "X-Claim-Secret";

    private final ClaimPackageParserService parserService;
    private final KeyReconstructionService keyReconstructionService;
    private final PayloadDecryptionService payloadDecryptionService;
    private final SecureRandom secureRandom = new SecureRandom();

    @Operation(summary = "Parse a claim package or direct message, decrypting it when the secret is supplied")
    @PostMapping("/parse")
    public ResponseEntity<?> parse(@RequestBody String claimJson,
                                   @RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        log.info("Parse claim input");
        try {
            MessageData message = parserService.parse(claimJson, Optional.ofNullable(secret));
            return ResponseEntity.ok(message);
        } catch (ClaimProcessingException e) {
            log.error("Rejected claim input ({})", e.getErrorType(), e);
            return ResponseEntity.badRequest().body(e.getErrorType() + ": " + e.getMessage());
        } catch (Exception e) {
            log.error("Failed to parse claim input", e);
            return ResponseEntity.internalServerError().body("Error parsing claim: " + e.getMessage());
        }
    }

    @Operation(summary = "Reconstruct the content key from the on-chain share and the off-chain secret")
    @PostMapping("/reconstruct-key")
    public ResponseEntity<?> reconstructKey(@Valid @RequestBody ReconstructKeyRequest request) {
        log.info("Reconstruct content key");
        try {
            byte[] key = keyReconstructionService.reconstruct(request.getSkShare(), request.getSecret());
            return ResponseEntity.ok(Map.of("key", HexUtils.toPrefixedHex(key)));
        } catch (ClaimProcessingException e) {
            log.error("Rejected key reconstruction ({})", e.getErrorType(), e);
            return ResponseEntity.badRequest().body(e.getErrorType() + ": " + e.getMessage());
        }
    }

    @Operation(summary = "Encrypt a message into an encryptedPayload for a claim package (random nonce unless given)")
    @PostMapping("/seal")
    public ResponseEntity<?> seal(@Valid @RequestBody SealRequest request) {
        log.info("Seal claim payload");
        try {
            byte[] key = decodeHex("key", request.getKey());
            byte[] nonce;
            if (request.getNonce() == null || request.getNonce().isBlank()) {
                nonce = new byte[PayloadDecryptionService.NONCE_LENGTH_BYTES];
                secureRandom.nextBytes(nonce);
            } else {
                nonce = decodeHex("nonce", request.getNonce());
            }
            byte[] payload = payloadDecryptionService.encrypt(key, nonce, request.getPlaintext());
            return ResponseEntity.ok(Map.of("encryptedPayload", HexUtils.toPrefixedHex(payload)));
        } catch (ClaimProcessingException e) {
            log.error("Rejected seal request ({})", e.getErrorType(), e);
            return ResponseEntity.badRequest().body(e.getErrorType() + ": " + e.getMessage());
        }
    }

    private static byte[] decodeHex(String field, String value) {
        try {
            return HexUtils.decode(value);
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException("'" + field + "' is not valid hex: " + e.getMessage(), e);
        }
    }

    @Data
    public static class SealRequest {
        @NotBlank
        private String key;
        private String nonce;
        @NotNull
        private String plaintext;
    }

    @Data
    public static class ReconstructKeyRequest {
        @NotBlank
        private String skShare;
        @NotBlank
        private String secret;
    }

}
