package com.sommerph.farewellbackend.model.claim;

import java.util.List;

/**
 * The two accepted input shapes. A claim package is recognised by its {@code type} marker,
 * anything else is read as a direct message.
 */
public sealed interface ClaimInput permits ClaimPackage, DirectMessage {

    List<String> recipients();

    String contentHash();

    String subject();

}
