// file: storage/src/main/java/io/dripline/storage/RootRegistry.java
package io.dripline.storage;

import io.dripline.core.Hash32;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Insert-only period -> root map. A period without an entry reads as
 * {@link Hash32#ZERO}. There is no update or remove.
 * Not thread-safe: the owning store serialises access.
 */
public final class RootRegistry {
    private final Map<Long, Hash32> roots = new HashMap<>();

    public Hash32 rootOf(long period) {
        return roots.getOrDefault(period, Hash32.ZERO);
    }

    public boolean isSet(long period) {
        return roots.containsKey(period);
    }

    /**
     * @throws IllegalStateException if the period already has a root
     */
    public void put(long period, Hash32 root) {
        Objects.requireNonNull(root, "root");
        if (root.isZero()) throw new IllegalArgumentException("root must be non-zero");
        Hash32 prev = roots.putIfAbsent(period, root);
        if (prev != null) {
            throw new IllegalStateException("root already set for period " + period);
        }
    }

    public int size() {
        return roots.size();
    }

    /** Read-only view for snapshots. */
    public Map<Long, Hash32> view() {
        return Collections.unmodifiableMap(roots);
    }
}
