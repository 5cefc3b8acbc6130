// file: core/src/main/java/io/dripline/core/Uint256.java
package io.dripline.core;

import java.math.BigInteger;

/**
 * Range checks and fixed-width encoding for unsigned 256-bit quantities.
 */
public final class Uint256 {

    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Uint256() {}

    /** @throws IllegalArgumentException if {@code v} is null, negative or wider than 256 bits */
    public static BigInteger require(BigInteger v, String name) {
        if (v == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (v.signum() < 0 || v.bitLength() > 256) {
            throw new IllegalArgumentException(name + " must be in [0, 2^256)");
        }
        return v;
    }

    /** Parse a decimal string into a checked uint256. */
    public static BigInteger parse(String decimal, String name) {
        if (decimal == null || decimal.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        try {
            return require(new BigInteger(decimal.trim()), name);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a decimal integer", e);
        }
    }

    /** 32-byte big-endian encoding. */
    public static byte[] toBytes32(BigInteger v) {
        require(v, "value");
        byte[] raw = v.toByteArray(); // may carry a leading sign byte
        byte[] out = new byte[32];
        int copy = Math.min(raw.length, 32);
        System.arraycopy(raw, raw.length - copy, out, 32 - copy, copy);
        return out;
    }

    /** 32-byte big-endian encoding of a non-negative long. */
    public static byte[] toBytes32(long v) {
        if (v < 0) {
            throw new IllegalArgumentException("value must be non-negative");
        }
        byte[] out = new byte[32];
        for (int i = 0; i < 8; i++) {
            out[31 - i] = (byte) (v >>> (8 * i));
        }
        return out;
    }
}
