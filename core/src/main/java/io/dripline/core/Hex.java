// file: core/src/main/java/io/dripline/core/Hex.java
package io.dripline.core;

/**
 * Hex helpers for the 0x-prefixed encodings used on the wire.
 */
public final class Hex {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {}

    /** Encode bytes as lowercase hex with a leading "0x". */
    public static String encode(byte[] bytes) {
        char[] out = new char[2 + bytes.length * 2];
        out[0] = '0';
        out[1] = 'x';
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[2 + i * 2] = DIGITS[v >>> 4];
            out[3 + i * 2] = DIGITS[v & 0x0F];
        }
        return new String(out);
    }

    /**
     * Decode hex into exactly {@code expectedLength} bytes.
     * The "0x" prefix is optional; case is ignored.
     *
     * @throws IllegalArgumentException on bad characters or a length mismatch
     */
    public static byte[] decode(String hex, int expectedLength) {
        if (hex == null) {
            throw new IllegalArgumentException("hex value is required");
        }
        String s = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (s.length() != expectedLength * 2) {
            throw new IllegalArgumentException(
                    "expected " + expectedLength + " hex-encoded bytes, got " + s.length() + " digits");
        }
        byte[] out = new byte[expectedLength];
        for (int i = 0; i < expectedLength; i++) {
            int hi = Character.digit(s.charAt(i * 2), 16);
            int lo = Character.digit(s.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("invalid hex digit in: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
