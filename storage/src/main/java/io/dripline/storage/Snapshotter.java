// file: storage/src/main/java/io/dripline/storage/Snapshotter.java
package io.dripline.storage;

import io.dripline.core.Hash32;

import java.util.List;
import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full image of roots and bitmap words at some sequence.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records with a higher sequence.
 */
public interface Snapshotter {

    /**
     * Persist a full image.
     *
     * @return snapshot identifier (e.g., filename)
     */
    String writeSnapshot(Image image);

    /** Load the latest snapshot, or null if there is none. */
    Image loadLatest();

    /** One bitmap word: 256 bits as four longs. */
    record Word(long period, long word, long[] bits) {}

    /** Full state as of {@code sequence}. */
    record Image(long sequence, Map<Long, Hash32> roots, List<Word> words) {}
}
