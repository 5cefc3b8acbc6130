// file: core/src/main/java/io/dripline/core/merkle/MerkleProofs.java
package io.dripline.core.merkle;

import io.dripline.core.Hash32;

import java.util.List;
import java.util.Objects;

/**
 * Merkle inclusion proofs over sorted pairs.
 * <p>
 * Each internal node is H(min(a, b) || max(a, b)) with the unsigned
 * big-endian order of {@link Hash32}. Because every pair is sorted before
 * hashing, a proof is just the list of siblings from leaf to root: it does
 * not encode left/right directions, and a tree builder must use the same rule.
 * <p>
 * All methods are pure; the same inputs always produce the same answer, so
 * off-chain tooling can call them to pre-check a claim.
 */
public final class MerkleProofs {

    private MerkleProofs() {}

    /**
     * @return true iff folding {@code proof} over {@code leaf} yields {@code root}.
     *         An empty proof verifies only when root equals leaf.
     */
    public static boolean verify(List<Hash32> proof, Hash32 root, Hash32 leaf) {
        Objects.requireNonNull(root, "root");
        return processProof(proof, leaf).equals(root);
    }

    /** Fold the proof over the leaf and return the implied root. */
    public static Hash32 processProof(List<Hash32> proof, Hash32 leaf) {
        Objects.requireNonNull(proof, "proof");
        Objects.requireNonNull(leaf, "leaf");
        Hash32 computed = leaf;
        for (Hash32 sibling : proof) {
            computed = hashPair(computed, Objects.requireNonNull(sibling, "proof element"));
        }
        return computed;
    }

    /** Parent of two nodes; commutative. */
    public static Hash32 hashPair(Hash32 a, Hash32 b) {
        return a.compareTo(b) <= 0 ? Hashing.concat(a, b) : Hashing.concat(b, a);
    }
}
