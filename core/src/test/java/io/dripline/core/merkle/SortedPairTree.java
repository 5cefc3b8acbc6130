package io.dripline.core.merkle;

import io.dripline.core.Hash32;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal sorted-pair Merkle tree builder for tests. Mirrors what an off-chain
 * tree builder does: hash each level pairwise with {@link MerkleProofs#hashPair},
 * carrying an odd last node up unchanged.
 */
final class SortedPairTree {
    private final List<List<Hash32>> levels = new ArrayList<>();

    SortedPairTree(List<Hash32> leaves) {
        if (leaves.isEmpty()) throw new IllegalArgumentException("need at least one leaf");
        List<Hash32> level = List.copyOf(leaves);
        levels.add(level);
        while (level.size() > 1) {
            List<Hash32> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                if (i + 1 < level.size()) {
                    next.add(MerkleProofs.hashPair(level.get(i), level.get(i + 1)));
                } else {
                    next.add(level.get(i));
                }
            }
            level = next;
            levels.add(level);
        }
    }

    Hash32 root() {
        return levels.get(levels.size() - 1).get(0);
    }

    List<Hash32> proof(int position) {
        List<Hash32> proof = new ArrayList<>();
        int pos = position;
        for (int depth = 0; depth < levels.size() - 1; depth++) {
            List<Hash32> level = levels.get(depth);
            int sibling = (pos % 2 == 0) ? pos + 1 : pos - 1;
            if (sibling < level.size()) {
                proof.add(level.get(sibling));
            }
            pos /= 2;
        }
        return proof;
    }
}
