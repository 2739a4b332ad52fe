package com.sommerph.farewellbackend.service.claim;

import com.sommerph.farewellbackend.exception.KeyLengthMismatchException;
import com.sommerph.farewellbackend.util.HexUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the AES-128 content key of a claim package: {@code key = skShare XOR secret}.
 * The share is published on-chain, the secret is handed to the recipient out-of-band.
 */
@Slf4j
@Service
public class KeyReconstructionService {

    public static final int KEY_LENGTH_BYTES = 16;

    public byte[] reconstruct(String skShareHex, String secretHex) {
        log.info("Reconstruct content key from on-chain share and off-chain secret");
        byte[] share = decodeKeyPart(skShareHex, "skShare");
        byte[] secret = decodeKeyPart(secretHex, "secret");
        return reconstruct(share, secret);
    }

    public byte[] reconstruct(byte[] share, byte[] secret) {
        if (share.length != secret.length) {
            throw new KeyLengthMismatchException(
                    "skShare is " + share.length + " bytes but secret is " + secret.length + " bytes");
        }
        if (share.length != KEY_LENGTH_BYTES) {
            throw new KeyLengthMismatchException(
                    "Key parts must be " + KEY_LENGTH_BYTES + " bytes for AES-128-GCM, got " + share.length);
        }
        return xor(share, secret);
    }

    public static byte[] xor(byte[] a, byte[] b) {
        if (a.length != b.length) {
            throw new KeyLengthMismatchException("Cannot XOR " + a.length + " bytes with " + b.length + " bytes");
        }
        byte[] out = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (byte) (a[i] ^ b[i]);
        }
        return out;
    }

    private byte[] decodeKeyPart(String hex, String name) {
        try {
            return HexUtils.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new KeyLengthMismatchException("Cannot decode " + name + ": " + e.getMessage(), e);
        }
    }

}
