package com.sommerph.farewellbackend.util;

import org.bouncycastle.crypto.digests.KeccakDigest;

import java.nio.charset.StandardCharsets;

public class HashUtils {

    public static final int KECCAK_256_BYTES = 32;

    /** 32 zero bytes, {@code 0x}-prefixed. */
    public static final String ZERO_WORD = "0x" + "00".repeat(KECCAK_256_BYTES);

    private HashUtils() {}

    /** Ethereum flavoured Keccak-256 (original padding, not SHA3-256). */
    public static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[KECCAK_256_BYTES];
        digest.doFinal(out, 0);
        return out;
    }

    public static byte[] keccak256(String input) {
        return keccak256(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String keccak256Hex(String input) {
        return HexUtils.toPrefixedHex(keccak256(input));
    }

}
