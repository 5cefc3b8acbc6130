// file: core/src/main/java/io/dripline/core/merkle/Hashing.java
package io.dripline.core.merkle;

import io.dripline.core.Hash32;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers shared by leaf encoding and proof verification.
 */
public final class Hashing {

    private Hashing() {}

    /** Compute H(part1 || part2 || ...). */
    public static Hash32 sha256(byte[]... parts) {
        var md = newDigest();
        for (var p : parts) md.update(p);
        return Hash32.of(md.digest());
    }

    /** Hash two nodes in the given order: H(left || right). */
    static Hash32 concat(Hash32 left, Hash32 right) {
        var md = newDigest();
        md.update(left.toBytes());
        md.update(right.toBytes());
        return Hash32.of(md.digest());
    }

    static MessageDigest newDigest() {
        try { return MessageDigest.getInstance("SHA-256"); }
        catch (NoSuchAlgorithmException e) { throw new IllegalStateException("SHA-256 unavailable", e); }
    }
}
