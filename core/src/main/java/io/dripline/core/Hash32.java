// file: core/src/main/java/io/dripline/core/Hash32.java
package io.dripline.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 32-byte hash value (Merkle roots, leaves and proof siblings).
 * <p>
 * Ordering is unsigned big-endian, i.e. the natural order of the value
 * read as a 256-bit unsigned integer. The Merkle verifier relies on this
 * order to sort each sibling pair before hashing.
 */
public final class Hash32 implements Comparable<Hash32> {

    public static final int LENGTH = 32;

    /** The unset value: a period without a published root reads as ZERO. */
    public static final Hash32 ZERO = new Hash32(new byte[LENGTH]);

    private final byte[] bytes;

    private Hash32(byte[] bytes) {
        this.bytes = bytes;
    }

    /** Wrap a copy of exactly 32 bytes. */
    public static Hash32 of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("hash must be 32 bytes, got " + bytes.length);
        }
        return new Hash32(bytes.clone());
    }

    /** Parse a 0x-prefixed (or bare) 64-digit hex string. */
    public static Hash32 fromHex(String hex) {
        return new Hash32(Hex.decode(hex, LENGTH));
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }

    /** Defensive copy of the raw bytes. */
    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Hex.encode(bytes);
    }

    /** Copy of this value with bit {@code bit} (0 = most significant) flipped. */
    public Hash32 flipBit(int bit) {
        if (bit < 0 || bit >= LENGTH * 8) {
            throw new IllegalArgumentException("bit out of range: " + bit);
        }
        byte[] copy = bytes.clone();
        copy[bit >>> 3] ^= (byte) (0x80 >>> (bit & 7));
        return new Hash32(copy);
    }

    @Override
    public int compareTo(Hash32 other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash32 other)) return false;
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
