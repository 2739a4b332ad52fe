package com.sommerph.farewellbackend.service.claim;

import com.sommerph.farewellbackend.exception.DecryptionAuthFailureException;
import com.sommerph.farewellbackend.exception.EncodingErrorException;
import com.sommerph.farewellbackend.exception.KeyLengthMismatchException;
import com.sommerph.farewellbackend.exception.MalformedInputException;
import com.sommerph.farewellbackend.exception.MalformedPayloadException;
import com.sommerph.farewellbackend.util.HexUtils;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * AES-GCM decryption of the encoded claim payload {@code nonce(12) || ciphertext(N) || tag(16)}.
 * <p>
 * The tag is always verified before any plaintext is released; a payload that fails verification
 * yields no output at all.
 */
@Slf4j
@Service
public class PayloadDecryptionService {

    public static final int NONCE_LENGTH_BYTES = 12;
    public static final int TAG_LENGTH_BYTES = 16;
    public static final int MIN_PAYLOAD_BYTES = NONCE_LENGTH_BYTES + TAG_LENGTH_BYTES;

    public String decrypt(byte[] key, String encryptedPayloadHex) {
        byte[] payload;
        try {
            payload = HexUtils.decode(encryptedPayloadHex);
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException("encryptedPayload is not valid hex: " + e.getMessage(), e);
        }
        return decrypt(key, payload);
    }

    public String decrypt(byte[] key, byte[] payload) {
        log.info("Decrypt claim payload of {} bytes", payload.length);
        requireKey(key);
        if (payload.length < MIN_PAYLOAD_BYTES) {
            throw new MalformedPayloadException("encryptedPayload is " + payload.length
                    + " bytes, shorter than the " + MIN_PAYLOAD_BYTES + " bytes of nonce and tag");
        }
        byte[] nonce = Arrays.copyOfRange(payload, 0, NONCE_LENGTH_BYTES);
        byte[] sealed = Arrays.copyOfRange(payload, NONCE_LENGTH_BYTES, payload.length);

        GCMModeCipher cipher = newCipher(false, key, nonce);
        byte[] plain = new byte[cipher.getOutputSize(sealed.length)];
        try {
            int len = cipher.processBytes(sealed, 0, sealed.length, plain, 0);
            len += cipher.doFinal(plain, len);
            return decodeUtf8(Arrays.copyOf(plain, len));
        } catch (InvalidCipherTextException e) {
            Arrays.fill(plain, (byte) 0);
            throw new DecryptionAuthFailureException(
                    "AES-GCM tag verification failed: wrong key, wrong nonce or tampered ciphertext", e);
        }
    }

    /** Produces a payload in the same layout {@link #decrypt(byte[], byte[])} reads. */
    public byte[] encrypt(byte[] key, byte[] nonce, String plaintext) {
        requireKey(key);
        if (nonce.length != NONCE_LENGTH_BYTES) {
            throw new MalformedInputException("nonce must be " + NONCE_LENGTH_BYTES + " bytes, got " + nonce.length);
        }
        byte[] in = plaintext.getBytes(StandardCharsets.UTF_8);
        GCMModeCipher cipher = newCipher(true, key, nonce);
        byte[] out = new byte[NONCE_LENGTH_BYTES + cipher.getOutputSize(in.length)];
        System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH_BYTES);
        try {
            int len = cipher.processBytes(in, 0, in.length, out, NONCE_LENGTH_BYTES);
            cipher.doFinal(out, NONCE_LENGTH_BYTES + len);
        } catch (InvalidCipherTextException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
        return out;
    }

    private GCMModeCipher newCipher(boolean forEncryption, byte[] key, byte[] nonce) {
        GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
        cipher.init(forEncryption, new AEADParameters(new KeyParameter(key), TAG_LENGTH_BYTES * 8, nonce));
        return cipher;
    }

    private void requireKey(byte[] key) {
        if (key == null || key.length != KeyReconstructionService.KEY_LENGTH_BYTES) {
            throw new KeyLengthMismatchException("Content key must be " + KeyReconstructionService.KEY_LENGTH_BYTES
                    + " bytes, got " + (key == null ? "none" : key.length));
        }
    }

    private String decodeUtf8(byte[] plain) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plain))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EncodingErrorException("Decrypted payload is authentic but not valid UTF-8 text", e);
        }
    }

}
