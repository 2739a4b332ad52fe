package com.sommerph.farewellbackend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP-layer tests over the full application context with the in-memory proof registry.
 */
@SpringBootTest(properties = "farewell.proof.registry.type=memory")
@AutoConfigureMockMvc
class DeliveryProofControllerTest {

    private static final String DIRECT =
            "{\"recipients\":[\"a@x.com\"],\"contentHash\":\"0xdead\",\"message\":\"hi\",\"subject\":\"s\"}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void parseDirectMessage() throws Exception {
        mockMvc.perform(post("/api/claim/parse").contentType(MediaType.APPLICATION_JSON).content(DIRECT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recipients", hasSize(1)))
                .andExpect(jsonPath("$.body").value("hi"))
                .andExpect(jsonPath("$.bodySource").value("DIRECT"));
    }

    @Test
    void parseRejectsMissingFieldWithDiagnostic() throws Exception {
        mockMvc.perform(post("/api/claim/parse").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipients\":[\"a@x.com\"],\"contentHash\":\"0xdead\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("MISSING_FIELD")))
                .andExpect(content().string(containsString("'message'")));
    }

    @Test
    void reconstructKeyFromZeroParts() throws Exception {
        String zeros = "00".repeat(16);
        mockMvc.perform(post("/api/claim/reconstruct-key").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"skShare\":\"" + zeros + "\",\"secret\":\"" + zeros + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key").value("0x" + zeros));
    }

    @Test
    void sealedPayloadOpensThroughParse() throws Exception {
        String zeros = "00".repeat(16);
        String sealed = mockMvc.perform(post("/api/claim/seal").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"" + zeros + "\",\"plaintext\":\"goodbye\"}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        ObjectNode claim = objectMapper.createObjectNode();
        claim.put("type", "farewell-claim-package");
        claim.putArray("recipients").add("a@x.com");
        claim.put("skShare", zeros);
        claim.put("encryptedPayload", objectMapper.readTree(sealed).get("encryptedPayload").asText());
        claim.put("contentHash", "0xdead");

        mockMvc.perform(post("/api/claim/parse").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Claim-Secret", zeros)
                        .content(claim.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.body").value("goodbye"))
                .andExpect(jsonPath("$.bodySource").value("DECRYPTED"));
    }

    @Test
    void sealWithFixedNonceIsDeterministicAndRejectsShortKey() throws Exception {
        String request = "{\"key\":\"" + "11".repeat(16) + "\",\"nonce\":\"" + "22".repeat(12)
                + "\",\"plaintext\":\"x\"}";
        String first = mockMvc.perform(post("/api/claim/seal").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.encryptedPayload", startsWith("0x" + "22".repeat(12))))
                .andReturn().getResponse().getContentAsString();
        mockMvc.perform(post("/api/claim/seal").contentType(MediaType.APPLICATION_JSON).content(request))
                .andExpect(content().json(first));

        mockMvc.perform(post("/api/claim/seal").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"00\",\"plaintext\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("KEY_LENGTH_MISMATCH")));
    }

    @Test
    void unprefixedContentHashIsStoredPrefixed() throws Exception {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("owner", "0xcafe");
        request.put("messageIndex", 4);
        request.set("claim", objectMapper.readTree(
                "{\"recipients\":[\"a@x.com\"],\"contentHash\":\"dead\",\"message\":\"hi\"}"));
        request.putArray("sentMessages").add("To: a@x.com\r\n\r\nhi");

        mockMvc.perform(post("/api/proof/delivery").contentType(MediaType.APPLICATION_JSON)
                        .content(request.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recipientProofs[0].publicSignals[2]").value("0xdead"));
    }

    @Test
    void preparedProofCanBeFetchedAgain() throws Exception {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("owner", "0xfeed");
        request.put("messageIndex", 2);
        request.set("claim", objectMapper.readTree(DIRECT));
        request.putArray("sentMessages").add("To: a@x.com\r\nSubject: s\r\n\r\nhi");

        mockMvc.perform(post("/api/proof/delivery").contentType(MediaType.APPLICATION_JSON)
                        .content(request.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("farewell-delivery-proof"))
                .andExpect(jsonPath("$.recipientProofs", hasSize(1)))
                .andExpect(jsonPath("$.recipientProofs[0].pB", hasSize(2)))
                .andExpect(jsonPath("$.recipientProofs[0].publicSignals[2]").value("0xdead"));

        mockMvc.perform(get("/api/proof/delivery/0xfeed/2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value("0xfeed"))
                .andExpect(jsonPath("$.messageIndex").value(2));
    }

    @Test
    void unknownProofIsNotFound() throws Exception {
        mockMvc.perform(get("/api/proof/delivery/0xnobody/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void recipientCountMismatchIsBadRequest() throws Exception {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("owner", "0xfeed");
        request.put("messageIndex", 3);
        request.set("claim", objectMapper.readTree(DIRECT));
        request.putArray("sentMessages").add("one").add("two");

        mockMvc.perform(post("/api/proof/delivery").contentType(MediaType.APPLICATION_JSON)
                        .content(request.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("RECIPIENT_COUNT_MISMATCH")));
    }

    @Test
    void validateReportsVerdictAsData() throws Exception {
        mockMvc.perform(post("/api/proof/delivery/validate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"owner\":\"0xabc\",\"messageIndex\":0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.message", containsString("recipientProofs")));
    }

}
