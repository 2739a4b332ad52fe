package com.sommerph.farewellbackend.service.claim;

import com.sommerph.farewellbackend.util.HexUtils;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Independent AES-GCM reference (JDK provider) used to produce claim payload fixtures.
 */
public class CryptoTestUtils {

    private static final SecureRandom RANDOM = new SecureRandom();

    private CryptoTestUtils() {}

    public static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    /** nonce(12) || ciphertext || tag(16) */
    public static byte[] seal(byte[] key, byte[] plaintext) throws Exception {
        byte[] nonce = randomBytes(12);
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(128, nonce));
        byte[] sealed = cipher.doFinal(plaintext);
        byte[] out = new byte[nonce.length + sealed.length];
        System.arraycopy(nonce, 0, out, 0, nonce.length);
        System.arraycopy(sealed, 0, out, nonce.length, sealed.length);
        return out;
    }

    public static String sealHex(byte[] key, String plaintext) throws Exception {
        return HexUtils.toPrefixedHex(seal(key, plaintext.getBytes(StandardCharsets.UTF_8)));
    }

}
