package com.sommerph.farewellbackend.model.claim;

public enum BodySource {
    // body taken verbatim from a direct message
    DIRECT,
    // body recovered by local key reconstruction and decryption
    DECRYPTED,
    // body is the instruction text pointing at the external decrypter
    PLACEHOLDER
}
