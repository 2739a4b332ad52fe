package com.sommerph.farewellbackend.util;

import org.bouncycastle.util.encoders.Hex;

import java.util.regex.Pattern;

public class HexUtils {

    private HexUtils() {}

    private static final Pattern HEX_PATTERN = Pattern.compile("^[0-9a-fA-F]*$");

    /** Removes a leading {@code 0x}/{@code 0X}, if any. */
    public static String strip0x(String hex) {
        if (hex != null && (hex.startsWith("0x") || hex.startsWith("0X"))) {
            return hex.substring(2);
        }
        return hex;
    }

    /** True for a non-empty string of hex digits, optionally {@code 0x}-prefixed. Odd lengths are allowed. */
    public static boolean isHex(String value) {
        String digits = strip0x(value);
        return digits != null && !digits.isEmpty() && HEX_PATTERN.matcher(digits).matches();
    }

    /**
     * Decodes an optionally {@code 0x}-prefixed hex string.
     *
     * @throws IllegalArgumentException if the input is null, has an odd number of digits or contains non-hex characters
     */
    public static byte[] decode(String hex) {
        String digits = strip0x(hex);
        if (digits == null) {
            throw new IllegalArgumentException("hex value is null");
        }
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("hex value has an odd number of digits (" + digits.length() + ")");
        }
        if (!HEX_PATTERN.matcher(digits).matches()) {
            throw new IllegalArgumentException("hex value contains non-hex characters");
        }
        return Hex.decode(digits);
    }

    public static String toHex(byte[] data) {
        return Hex.toHexString(data);
    }

    public static String toPrefixedHex(byte[] data) {
        return "0x" + Hex.toHexString(data);
    }

}
