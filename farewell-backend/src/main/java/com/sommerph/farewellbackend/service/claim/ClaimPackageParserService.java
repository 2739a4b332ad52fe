package com.sommerph.farewellbackend.service.claim;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.farewellbackend.config.ClaimProperties;
import com.sommerph.farewellbackend.exception.MalformedInputException;
import com.sommerph.farewellbackend.exception.MissingFieldException;
import com.sommerph.farewellbackend.model.claim.BodySource;
import com.sommerph.farewellbackend.model.claim.ClaimInput;
import com.sommerph.farewellbackend.model.claim.ClaimPackage;
import com.sommerph.farewellbackend.model.claim.DirectMessage;
import com.sommerph.farewellbackend.model.claim.MessageData;
import com.sommerph.farewellbackend.util.HexUtils;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns either accepted input shape into {@link MessageData}.
 * <p>
 * Claim packages ({@code "type": "farewell-claim-package"}) are decrypted locally when the off-chain
 * secret is supplied and local decryption is enabled; otherwise the body becomes an instruction
 * pointing the recipient at the external decrypter. Everything without that marker is a direct
 * message, which never needs key material.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimPackageParserService {

    public static final String FIELD_TYPE = "type";
    public static final String FIELD_RECIPIENTS = "recipients";
    public static final String FIELD_SK_SHARE = "skShare";
    public static final String FIELD_ENCRYPTED_PAYLOAD = "encryptedPayload";
    public static final String FIELD_CONTENT_HASH = "contentHash";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_SUBJECT = "subject";

    private final ObjectMapper objectMapper;
    private final KeyReconstructionService keyReconstructionService;
    private final PayloadDecryptionService payloadDecryptionService;
    private final ClaimProperties claimProperties;

    @PostConstruct
    public void logMode() {
        log.info("Claim package mode: {}", claimProperties.isLocalDecryptionEnabled()
                ? "local decryption when the secret is supplied"
                : "always defer to external decrypter at " + claimProperties.getPlaceholder().getDecrypterUrl());
    }

    public MessageData parse(String json, Optional<String> secret) {
        return toMessageData(readInput(json), secret);
    }

    public MessageData parse(JsonNode root, Optional<String> secret) {
        return toMessageData(readInput(root), secret);
    }

    public ClaimInput readInput(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("Input is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return readInput(root);
    }

    public ClaimInput readInput(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MalformedInputException("Input must be a JSON object");
        }
        if (ClaimPackage.TYPE.equals(root.path(FIELD_TYPE).asText(null))) {
            log.info("Read claim package input");
            return new ClaimPackage(
                    readRecipients(root, "claim package"),
                    optionalText(root, FIELD_SK_SHARE),
                    optionalText(root, FIELD_ENCRYPTED_PAYLOAD),
                    readContentHash(root, "claim package"),
                    optionalText(root, FIELD_SUBJECT)
            );
        }
        log.info("Read direct message input");
        return new DirectMessage(
                readRecipients(root, "direct message"),
                readContentHash(root, "direct message"),
                requiredText(root, FIELD_MESSAGE, "direct message"),
                optionalText(root, FIELD_SUBJECT)
        );
    }

    public MessageData toMessageData(ClaimInput input, Optional<String> secret) {
        if (input instanceof DirectMessage direct) {
            return new MessageData(direct.recipients(), direct.contentHash(), direct.message(),
                    direct.subject(), BodySource.DIRECT);
        }
        if (input instanceof ClaimPackage claim) {
            return openClaimPackage(claim, secret);
        }
        throw new IllegalStateException("Unhandled claim input variant: " + input.getClass().getName());
    }

    private MessageData openClaimPackage(ClaimPackage claim, Optional<String> secret) {
        Optional<String> usableSecret = secret.filter(s -> !s.isBlank());
        if (usableSecret.isEmpty() || !claimProperties.isLocalDecryptionEnabled()) {
            log.info("No local decryption for claim package with {} recipient(s), using external decrypter placeholder",
                    claim.recipients().size());
            return new MessageData(claim.recipients(), claim.contentHash(), claimProperties.placeholderBody(),
                    claim.subject(), BodySource.PLACEHOLDER);
        }
        if (claim.skShare() == null) {
            throw new MissingFieldException(FIELD_SK_SHARE, "claim package (required when a secret is supplied)");
        }
        if (claim.encryptedPayload() == null) {
            throw new MissingFieldException(FIELD_ENCRYPTED_PAYLOAD, "claim package (required when a secret is supplied)");
        }
        byte[] key = keyReconstructionService.reconstruct(claim.skShare(), usableSecret.get());
        String body = payloadDecryptionService.decrypt(key, claim.encryptedPayload());
        return new MessageData(claim.recipients(), claim.contentHash(), body, claim.subject(), BodySource.DECRYPTED);
    }

    private List<String> readRecipients(JsonNode root, String context) {
        JsonNode node = root.get(FIELD_RECIPIENTS);
        if (node == null || node.isNull()) {
            throw new MissingFieldException(FIELD_RECIPIENTS, context);
        }
        if (!node.isArray()) {
            throw new MalformedInputException("'recipients' must be an array of email addresses");
        }
        if (node.isEmpty()) {
            throw new MalformedInputException("'recipients' must contain at least one address");
        }
        List<String> recipients = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            if (!entry.isTextual() || !isAddressShaped(entry.asText())) {
                throw new MalformedInputException("'recipients[" + i + "]' is not a valid email address: " + entry);
            }
            recipients.add(entry.asText());
        }
        return recipients;
    }

    private String readContentHash(JsonNode root, String context) {
        String contentHash = requiredText(root, FIELD_CONTENT_HASH, context);
        if (!HexUtils.isHex(contentHash)) {
            throw new MalformedInputException("'contentHash' must be a hex string, got: " + contentHash);
        }
        // always 0x-prefixed so proof signals never read bare hex digits as decimal
        return "0x" + HexUtils.strip0x(contentHash).toLowerCase(Locale.ROOT);
    }

    static boolean isAddressShaped(String address) {
        return !address.isEmpty() && address.contains("@") && address.equals(address.strip());
    }

    private static String requiredText(JsonNode root, String field, String context) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new MissingFieldException(field, context);
        }
        if (!node.isTextual()) {
            throw new MalformedInputException("'" + field + "' must be a string");
        }
        return node.asText();
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new MalformedInputException("'" + field + "' must be a string");
        }
        return node.asText();
    }

}
