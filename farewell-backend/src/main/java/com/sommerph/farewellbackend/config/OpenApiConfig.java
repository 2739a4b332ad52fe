package com.sommerph.farewellbackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI farewellBackendOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Farewell Claim API")
                        .version("1.0.0")
                        .description("API for opening Farewell claim packages and assembling delivery proofs for on-chain submission."));
    }

    @Bean
    public GroupedOpenApi claimGroup() {
        return GroupedOpenApi.builder()
                .group("claim")
                .pathsToMatch("/api/claim/**")
                .build();
    }

    @Bean
    public GroupedOpenApi deliveryProofGroup() {
        return GroupedOpenApi.builder()
                .group("delivery-proof")
                .pathsToMatch("/api/proof/delivery/**")
                .build();
    }

}
