package com.sommerph.farewellbackend.model.claim;

import java.util.List;

public record MessageData(
        List<String> recipients,
        String contentHash,
        String body,
        String subject,
        BodySource bodySource
) {

    public MessageData {
        recipients = List.copyOf(recipients);
    }

    public int recipientCount() {
        return recipients.size();
    }

}
