package com.sommerph.farewellbackend.service.proof;

import com.sommerph.farewellbackend.config.DeliveryProofProperties;
import com.sommerph.farewellbackend.exception.MalformedInputException;
import com.sommerph.farewellbackend.exception.RecipientCountMismatchException;
import com.sommerph.farewellbackend.model.claim.MessageData;
import com.sommerph.farewellbackend.model.proof.DeliveryProof;
import com.sommerph.farewellbackend.model.proof.ProofMetadata;
import com.sommerph.farewellbackend.model.proof.RecipientProof;
import com.sommerph.farewellbackend.util.HashUtils;
import com.sommerph.farewellbackend.util.MailHeaderUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Builds per-recipient proof records and the delivery proof envelope around them.
 * <p>
 * The Groth16 points are emitted as zero placeholders; the external prover replaces them. What this
 * service guarantees is the shape of every array and public signals bound to the right recipient
 * commitment and content hash.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProofAssemblyService {

    public static final String GENERATOR = "farewell-backend";
    private static final String PLACEHOLDER = "0";

    private final RecipientCommitmentService recipientCommitmentService;
    private final DeliveryProofProperties properties;
    private final Clock clock;

    public RecipientProof assembleRecipientProof(int recipientIndex, String contentHash, String recipient, String rawMessage) {
        log.info("Assemble proof for recipient index {}", recipientIndex);
        if (rawMessage == null || rawMessage.isBlank()) {
            throw new MalformedInputException("Sent message for recipient index " + recipientIndex + " is empty");
        }
        String recipientHash = recipientCommitmentService.commit(recipient);
        String dkimKeyHash = MailHeaderUtils.findHeader(rawMessage, "DKIM-Signature")
                .map(HashUtils::keccak256Hex)
                .orElse(HashUtils.ZERO_WORD);

        return new RecipientProof(
                recipientIndex,
                recipientHash,
                List.of(PLACEHOLDER, PLACEHOLDER),
                List.of(List.of(PLACEHOLDER, PLACEHOLDER), List.of(PLACEHOLDER, PLACEHOLDER)),
                List.of(PLACEHOLDER, PLACEHOLDER),
                List.of(recipientHash, dkimKeyHash, contentHash)
        );
    }

    /** One proof per recipient, index-aligned with {@code message.recipients()}. */
    public List<RecipientProof> assembleRecipientProofs(MessageData message, List<String> rawMessages) {
        if (rawMessages.size() != message.recipientCount()) {
            throw new RecipientCountMismatchException("sent messages", message.recipientCount(), rawMessages.size());
        }
        IntStream indices = IntStream.range(0, message.recipientCount());
        if (properties.isParallelAssembly()) {
            indices = indices.parallel();
        }
        // toList keeps encounter order, so parallel results stay aligned with the recipient list
        return indices
                .mapToObj(i -> assembleRecipientProof(i, message.contentHash(), message.recipients().get(i), rawMessages.get(i)))
                .toList();
    }

    public DeliveryProof buildEnvelope(String owner, long messageIndex, MessageData message, List<RecipientProof> recipientProofs) {
        log.info("Build delivery proof envelope for owner {} message {}", owner, messageIndex);
        if (owner == null || owner.isBlank()) {
            throw new MalformedInputException("'owner' must be a non-empty address");
        }
        if (messageIndex < 0) {
            throw new MalformedInputException("'messageIndex' must be non-negative, got " + messageIndex);
        }
        if (recipientProofs.size() != message.recipientCount()) {
            throw new RecipientCountMismatchException("recipient proofs", message.recipientCount(), recipientProofs.size());
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < recipientProofs.size(); i++) {
            RecipientProof proof = recipientProofs.get(i);
            if (proof.recipientIndex() != i) {
                throw new MalformedInputException("Recipient proof at position " + i
                        + " carries recipientIndex " + proof.recipientIndex());
            }
            if (!seen.add(proof.recipientHash())) {
                throw new MalformedInputException("Duplicate recipient at index " + i + " (" + proof.recipientHash() + ")");
            }
        }
        ProofMetadata metadata = new ProofMetadata(Instant.now(clock).toString(), recipientProofs.size(), GENERATOR);
        return new DeliveryProof(DeliveryProof.TYPE, DeliveryProof.VERSION, owner, messageIndex, recipientProofs, metadata);
    }

    public DeliveryProof assemble(String owner, long messageIndex, MessageData message, List<String> rawMessages) {
        return buildEnvelope(owner, messageIndex, message, assembleRecipientProofs(message, rawMessages));
    }

}
