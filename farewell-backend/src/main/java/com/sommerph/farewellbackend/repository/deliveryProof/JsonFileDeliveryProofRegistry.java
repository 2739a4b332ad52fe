package com.sommerph.farewellbackend.repository.deliveryProof;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.farewellbackend.exception.MalformedInputException;
import com.sommerph.farewellbackend.model.proof.DeliveryProof;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.*;
import java.util.Locale;
import java.util.regex.Pattern;

@Slf4j
public class JsonFileDeliveryProofRegistry implements DeliveryProofRegistry {

    private static final Pattern SAFE_OWNER = Pattern.compile("^[A-Za-z0-9_-]+$");

    private final Path storageDir;
    private final ObjectMapper mapper;

    public JsonFileDeliveryProofRegistry(String storagePath, ObjectMapper objectMapper) throws IOException {
        this.storageDir = Paths.get(storagePath);
        Files.createDirectories(storageDir);
        this.mapper = objectMapper.copy();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(DeliveryProof proof) {
        Path path = resolve(proof.owner(), proof.messageIndex());
        try {
            mapper.writeValue(path.toFile(), proof);
            log.info("Successfully wrote file: {}", path);
        } catch (IOException e) {
            log.error("Failed to write file: {}", path, e);
            throw new RuntimeException("Failed to write file: " + path, e);
        }
    }

    @Override
    public DeliveryProof load(String owner, long messageIndex) {
        Path path = resolve(owner, messageIndex);
        try {
            return mapper.readValue(path.toFile(), DeliveryProof.class);
        } catch (IOException e) {
            log.error("Failed to read file: {}", path, e);
            throw new RuntimeException("Failed to read file: " + path, e);
        }
    }

    @Override
    public boolean exists(String owner, long messageIndex) {
        return Files.exists(resolve(owner, messageIndex));
    }

    // File naming convention is <owner>-<messageIndex>-delivery-proof.json
    private Path resolve(String owner, long messageIndex) {
        if (owner == null || !SAFE_OWNER.matcher(owner).matches()) {
            throw new MalformedInputException("Owner '" + owner + "' cannot be used as a storage key");
        }
        return storageDir.resolve(owner.toLowerCase(Locale.ROOT) + "-" + messageIndex + "-delivery-proof.json");
    }

}
