// file: storage/src/main/java/io/dripline/storage/DistributorStore.java
package io.dripline.storage;

import io.dripline.core.Hash32;

import java.util.List;

/**
 * Process-wide distributor state: the root registry and the claimed bitmap.
 * <p>
 * Semantics:
 *  - reads see every committed mutation and nothing else,
 *  - commit() is atomic and durable before returning: either every mutation of
 *    the list is applied (and survives a restart) or none is,
 *  - commit() rejects a list that would overwrite a root or re-set a bit.
 */
public interface DistributorStore {

    /** Root for the period, or {@link Hash32#ZERO} when unset. */
    Hash32 rootOf(long period);

    boolean isClaimed(long period, long index);

    long claimedCount(long period);

    /**
     * Apply a list of mutations as one atomic unit.
     *
     * @throws IllegalStateException if any mutation conflicts with committed state
     *         or with an earlier mutation in the same list; nothing is applied
     */
    void commit(List<StateMutation> mutations);

    /** Sequence number of the last committed unit, 0 for an empty store. */
    long lastSequence();
}
