package com.sommerph.farewellbackend.model.claim;

import java.util.List;

public record ClaimPackage(
        List<String> recipients,
        String skShare,          // hex, 16 bytes; may be null
        String encryptedPayload, // hex, nonce || ciphertext || tag; may be null
        String contentHash,
        String subject
) implements ClaimInput {

    public static final String TYPE = "farewell-claim-package";

    public ClaimPackage {
        recipients = List.copyOf(recipients);
    }

}
