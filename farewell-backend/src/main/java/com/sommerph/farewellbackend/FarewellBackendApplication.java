package com.sommerph.farewellbackend;

import com.sommerph.farewellbackend.config.ClaimProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ClaimProperties.class)
public class FarewellBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(FarewellBackendApplication.class, args);
	}

}
