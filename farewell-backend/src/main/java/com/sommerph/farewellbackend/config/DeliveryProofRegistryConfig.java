package com.sommerph.farewellbackend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.farewellbackend.repository.deliveryProof.DeliveryProofRegistry;
import com.sommerph.farewellbackend.repository.deliveryProof.InMemoryDeliveryProofRegistry;
import com.sommerph.farewellbackend.repository.deliveryProof.JsonFileDeliveryProofRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.Locale;

@Configuration
public class DeliveryProofRegistryConfig {

    private final DeliveryProofProperties properties;

    public DeliveryProofRegistryConfig(DeliveryProofProperties properties) {
        this.properties = properties;
    }

    @Bean
    public DeliveryProofRegistry deliveryProofRegistry(ObjectMapper objectMapper) throws IOException {
        return switch (properties.getRegistry().getType().toLowerCase(Locale.ROOT)) {
            case "json" -> new JsonFileDeliveryProofRegistry(properties.getStorage().getPath(), objectMapper);
            case "memory" -> new InMemoryDeliveryProofRegistry();
            default -> throw new IllegalArgumentException("Unsupported delivery proof registry type: " + properties.getRegistry().getType());
        };
    }

}
