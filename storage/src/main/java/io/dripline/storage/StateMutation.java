// file: storage/src/main/java/io/dripline/storage/StateMutation.java
package io.dripline.storage;

import io.dripline.core.Hash32;

import java.util.Objects;

/**
 * A single state change. A committed call is an ordered list of these,
 * persisted as one WAL record so it is applied entirely or not at all.
 */
public sealed interface StateMutation permits StateMutation.RootSeeded, StateMutation.IndexClaimed {

    long period();

    /** A root published for a period. */
    record RootSeeded(long period, Hash32 root) implements StateMutation {
        public RootSeeded {
            if (period < 0) throw new IllegalArgumentException("period must be non-negative");
            Objects.requireNonNull(root, "root");
            if (root.isZero()) throw new IllegalArgumentException("root must be non-zero");
        }
    }

    /** One index marked claimed within a period. */
    record IndexClaimed(long period, long index) implements StateMutation {
        public IndexClaimed {
            if (period < 0) throw new IllegalArgumentException("period must be non-negative");
            if (index < 0) throw new IllegalArgumentException("index must be non-negative");
        }
    }
}
