// file: storage/src/main/java/io/dripline/storage/SnapshotPolicy.java
package io.dripline.storage;

import java.util.function.Supplier;

/**
 * Snapshot policy that triggers a full snapshot after every N commits.
 * Bounds worst-case recovery time by limiting WAL replay length.
 * Not thread-safe; called under the store lock.
 */
public final class SnapshotPolicy {
    private final int everyCommits;
    private int sinceLast;

    public SnapshotPolicy(int everyCommits) {
        if (everyCommits <= 0) throw new IllegalArgumentException("everyCommits must be > 0");
        this.everyCommits = everyCommits;
    }

    /**
     * Call after each durable commit. Builds and writes an image when the
     * threshold is hit.
     *
     * @return snapshot id when one was written, otherwise null
     */
    public String maybeSnapshot(Supplier<Snapshotter.Image> image, Snapshotter snaps) {
        if (++sinceLast < everyCommits) return null;
        sinceLast = 0;
        return snaps.writeSnapshot(image.get());
    }
}
