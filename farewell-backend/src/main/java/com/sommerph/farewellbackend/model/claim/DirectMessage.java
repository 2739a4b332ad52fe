package com.sommerph.farewellbackend.model.claim;

import java.util.List;

public record DirectMessage(
        List<String> recipients,
        String contentHash,
        String message,
        String subject
) implements ClaimInput {

    public DirectMessage {
        recipients = List.copyOf(recipients);
    }

}
