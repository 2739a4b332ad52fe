package com.sommerph.farewellbackend.service.proof;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.farewellbackend.model.proof.DeliveryProof;
import com.sommerph.farewellbackend.model.proof.ProofVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Shape check of a delivery proof envelope before it is submitted.
 * <p>
 * Works on untrusted input, so it never throws: every problem is reported as a failed
 * {@link ProofVerdict} naming the first offending field (and recipient index). Numeric content is
 * not range-checked against the circuit field.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryProofValidationService {

    private static final Pattern NUMERIC_STRING = Pattern.compile("^(0[xX][0-9a-fA-F]+|-?[0-9]+)$");

    private final ObjectMapper objectMapper;

    public ProofVerdict validate(Object candidate) {
        if (candidate instanceof JsonNode node) {
            return validate(node);
        }
        try {
            JsonNode tree = objectMapper.valueToTree(candidate);
            return validate(tree);
        } catch (IllegalArgumentException e) {
            log.error("Delivery proof candidate could not be converted to JSON", e);
            return ProofVerdict.fail("Delivery proof could not be read as JSON: " + e.getMessage());
        }
    }

    public ProofVerdict validateJson(String json) {
        try {
            return validate(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            return ProofVerdict.fail("Delivery proof is not valid JSON: " + e.getOriginalMessage());
        }
    }

    public ProofVerdict validate(JsonNode root) {
        ProofVerdict verdict = check(root);
        if (!verdict.valid()) {
            log.info("Delivery proof rejected: {}", verdict.message());
        }
        return verdict;
    }

    private ProofVerdict check(JsonNode root) {
        if (root == null || !root.isObject()) {
            return ProofVerdict.fail("Delivery proof must be a JSON object");
        }

        JsonNode type = root.get("type");
        if (type != null && !DeliveryProof.TYPE.equals(type.asText(null))) {
            return ProofVerdict.fail("Invalid type: expected '" + DeliveryProof.TYPE + "', got " + type);
        }

        JsonNode owner = root.get("owner");
        if (owner == null || owner.isNull()) {
            return ProofVerdict.fail("Missing field: owner");
        }
        if (!owner.isTextual() || owner.asText().isBlank()) {
            return ProofVerdict.fail("Field owner must be a non-empty string");
        }

        JsonNode messageIndex = root.get("messageIndex");
        if (messageIndex == null || messageIndex.isNull()) {
            return ProofVerdict.fail("Missing field: messageIndex");
        }
        if (!messageIndex.isIntegralNumber() || messageIndex.bigIntegerValue().signum() < 0) {
            return ProofVerdict.fail("Field messageIndex must be a non-negative integer, got " + messageIndex);
        }

        JsonNode proofs = root.get("recipientProofs");
        if (proofs == null || proofs.isNull()) {
            return ProofVerdict.fail("Missing field: recipientProofs");
        }
        if (!proofs.isArray() || proofs.isEmpty()) {
            return ProofVerdict.fail("Field recipientProofs must be a non-empty array");
        }

        for (int i = 0; i < proofs.size(); i++) {
            ProofVerdict recipientVerdict = checkRecipientProof(proofs.get(i), "recipientProofs[" + i + "]");
            if (!recipientVerdict.valid()) {
                return recipientVerdict;
            }
        }
        return ProofVerdict.pass();
    }

    private ProofVerdict checkRecipientProof(JsonNode proof, String path) {
        if (!proof.isObject()) {
            return ProofVerdict.fail(path + " must be an object");
        }
        JsonNode index = proof.get("recipientIndex");
        if (index != null && (!index.isIntegralNumber() || index.bigIntegerValue().signum() < 0)) {
            return ProofVerdict.fail(path + ".recipientIndex must be a non-negative integer");
        }

        ProofVerdict pA = checkVector(proof.get("pA"), path + ".pA", 2);
        if (!pA.valid()) {
            return pA;
        }

        JsonNode pB = proof.get("pB");
        if (pB == null || !pB.isArray() || pB.size() != 2) {
            return ProofVerdict.fail(path + ".pB must be a 2x2 array");
        }
        for (int row = 0; row < 2; row++) {
            ProofVerdict rowVerdict = checkVector(pB.get(row), path + ".pB[" + row + "]", 2);
            if (!rowVerdict.valid()) {
                return ProofVerdict.fail(path + ".pB must be a 2x2 array: " + rowVerdict.message());
            }
        }

        ProofVerdict pC = checkVector(proof.get("pC"), path + ".pC", 2);
        if (!pC.valid()) {
            return pC;
        }

        JsonNode signals = proof.get("publicSignals");
        if (signals == null || signals.isNull()) {
            return ProofVerdict.fail(path + " is missing publicSignals");
        }
        if (!signals.isArray() || signals.isEmpty()) {
            return ProofVerdict.fail(path + ".publicSignals must be a non-empty array");
        }
        return checkElements(signals, path + ".publicSignals");
    }

    private ProofVerdict checkVector(JsonNode node, String path, int expectedLength) {
        if (node == null || node.isNull()) {
            return ProofVerdict.fail(path + " is missing");
        }
        if (!node.isArray() || node.size() != expectedLength) {
            return ProofVerdict.fail(path + " must have exactly " + expectedLength + " elements");
        }
        return checkElements(node, path);
    }

    private ProofVerdict checkElements(JsonNode array, String path) {
        for (int i = 0; i < array.size(); i++) {
            if (!isNumeric(array.get(i))) {
                return ProofVerdict.fail(path + "[" + i + "] must be a number or numeric string, got " + array.get(i));
            }
        }
        return ProofVerdict.pass();
    }

    private static boolean isNumeric(JsonNode element) {
        if (element.isNumber()) {
            return true;
        }
        return element.isTextual() && NUMERIC_STRING.matcher(element.asText()).matches();
    }

}
