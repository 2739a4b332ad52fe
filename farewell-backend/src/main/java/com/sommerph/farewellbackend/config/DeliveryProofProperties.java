package com.sommerph.farewellbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "farewell.proof")
public class DeliveryProofProperties {

    private RegistryProperties registry = new RegistryProperties();
    private StorageProperties storage = new StorageProperties();
    private boolean parallelAssembly = true;

    @Data
    public static class RegistryProperties {
        private String type = "memory";
    }

    @Data
    public static class StorageProperties {
        private String path = "data/proofs";
    }

}
