// file: storage/src/main/java/io/dripline/storage/ClaimBitmap.java
package io.dripline.storage;

import java.util.HashMap;
import java.util.Map;

/**
 * Sparse per-period claimed bitmap.
 * <p>
 * Layout:
 *  - indices are grouped into 256-bit words: word = index >>> 8, bit = index & 0xFF,
 *  - a word is four longs; bit b lives in long b >>> 6 at position b & 63,
 *  - only touched words are materialised; a missing word reads as all zero.
 * <p>
 * Bits are only ever set. Not thread-safe: the owning store serialises access.
 */
public final class ClaimBitmap {
    static final int WORD_BITS = 256;
    static final int LONGS_PER_WORD = WORD_BITS / Long.SIZE;

    private final Map<Long, Map<Long, long[]>> periods = new HashMap<>();

    /** O(1). False for any index never marked, however large. */
    public boolean isClaimed(long period, long index) {
        Map<Long, long[]> words = periods.get(period);
        if (words == null) return false;
        long[] word = words.get(wordOf(index));
        if (word == null) return false;
        int bit = bitOf(index);
        return (word[bit >>> 6] & (1L << (bit & 63))) != 0;
    }

    /**
     * Set the bit for (period, index).
     *
     * @return true if the bit was newly set, false if it was already set
     */
    public boolean markClaimed(long period, long index) {
        long[] word = periods
                .computeIfAbsent(period, p -> new HashMap<>())
                .computeIfAbsent(wordOf(index), w -> new long[LONGS_PER_WORD]);
        int bit = bitOf(index);
        long mask = 1L << (bit & 63);
        boolean fresh = (word[bit >>> 6] & mask) == 0;
        word[bit >>> 6] |= mask;
        return fresh;
    }

    /** Number of claimed indices in a period. O(words touched). */
    public long claimedCount(long period) {
        Map<Long, long[]> words = periods.get(period);
        if (words == null) return 0;
        long n = 0;
        for (long[] w : words.values()) {
            for (long l : w) n += Long.bitCount(l);
        }
        return n;
    }

    /** Visit every materialised word; used by snapshots. */
    public void forEachWord(WordVisitor visitor) {
        for (var p : periods.entrySet()) {
            for (var w : p.getValue().entrySet()) {
                visitor.visit(p.getKey(), w.getKey(), w.getValue().clone());
            }
        }
    }

    /** OR a persisted word back in; used on recovery. */
    public void loadWord(long period, long word, long[] bits) {
        if (bits.length != LONGS_PER_WORD) {
            throw new IllegalArgumentException("word must be " + LONGS_PER_WORD + " longs");
        }
        long[] target = periods
                .computeIfAbsent(period, p -> new HashMap<>())
                .computeIfAbsent(word, w -> new long[LONGS_PER_WORD]);
        for (int i = 0; i < LONGS_PER_WORD; i++) target[i] |= bits[i];
    }

    static long wordOf(long index) {
        return index >>> 8;
    }

    static int bitOf(long index) {
        return (int) (index & 0xFF);
    }

    @FunctionalInterface
    public interface WordVisitor {
        void visit(long period, long word, long[] bits);
    }
}
