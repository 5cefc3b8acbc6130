// file: core/src/main/java/io/dripline/core/merkle/ClaimLeaf.java
package io.dripline.core.merkle;

import io.dripline.core.Address;
import io.dripline.core.Hash32;
import io.dripline.core.Uint256;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One entitlement (index, account, balance) and its leaf hash.
 * <p>
 * Encoding, 84 bytes, no separators:
 *   - index:   uint256, 32 bytes big-endian
 *   - account: 20 bytes
 *   - balance: uint256, 32 bytes big-endian
 * <p>
 * Tree builders must produce leaves byte-for-byte the same way.
 */
public record ClaimLeaf(long index, Address account, BigInteger balance) {

    public static final int ENCODED_LENGTH = 32 + Address.LENGTH + 32;

    public ClaimLeaf {
        if (index < 0) throw new IllegalArgumentException("index must be non-negative");
        Objects.requireNonNull(account, "account");
        Uint256.require(balance, "balance");
    }

    public byte[] encode() {
        byte[] out = new byte[ENCODED_LENGTH];
        System.arraycopy(Uint256.toBytes32(index), 0, out, 0, 32);
        System.arraycopy(account.toBytes(), 0, out, 32, Address.LENGTH);
        System.arraycopy(Uint256.toBytes32(balance), 0, out, 32 + Address.LENGTH, 32);
        return out;
    }

    public Hash32 hash() {
        return Hashing.sha256(encode());
    }
}
