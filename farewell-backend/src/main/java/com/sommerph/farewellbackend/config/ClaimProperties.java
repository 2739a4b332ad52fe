package com.sommerph.farewellbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "farewell.claim")
public class ClaimProperties {

    public static final String URL_TOKEN = "{url}";

    // When false, claim packages always resolve to the placeholder body, even if a secret is supplied
    private boolean localDecryptionEnabled = true;
    private Placeholder placeholder = new Placeholder();

    @Data
    public static class Placeholder {
        private String decrypterUrl = "https://farewell.world/decrypt";
        // {url} is replaced with decrypterUrl
        private String message = "This message was left for you on Farewell and is encrypted. "
                + "To read it, open {url} and use the claim package together with the secret "
                + "you received from the sender.";
    }

    public String placeholderBody() {
        return placeholder.getMessage().replace(URL_TOKEN, placeholder.getDecrypterUrl());
    }

}
