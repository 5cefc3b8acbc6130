// file: core/src/main/java/io/dripline/core/Address.java
package io.dripline.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * 20-byte account identifier. Encoded on the wire as 0x + 40 hex digits.
 */
public final class Address {

    public static final int LENGTH = 20;

    private final byte[] bytes;

    private Address(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Address of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("address must be 20 bytes, got " + bytes.length);
        }
        return new Address(bytes.clone());
    }

    public static Address fromHex(String hex) {
        return new Address(Hex.decode(hex, LENGTH));
    }

    /** Address whose low 8 bytes hold {@code v}; handy for fixtures and defaults. */
    public static Address ofLong(long v) {
        byte[] b = new byte[LENGTH];
        for (int i = 0; i < 8; i++) {
            b[LENGTH - 1 - i] = (byte) (v >>> (8 * i));
        }
        return new Address(b);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Hex.encode(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
