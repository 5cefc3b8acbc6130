// file: server/src/main/java/io/dripline/server/ClaimTransaction.java
package io.dripline.server;

import io.dripline.core.Hash32;
import io.dripline.server.events.ClaimEvent;
import io.dripline.storage.DistributorStore;
import io.dripline.storage.StateMutation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Staged changes of one open distributor call.
 * <p>
 * Reads fall through: own staged state, then the enclosing transaction (for a
 * re-entrant call), then committed store state. Writes are only staged. The
 * owner either drops the transaction (rollback), merges it into its parent
 * (nested success) or commits its mutations to the store (outermost success).
 */
final class ClaimTransaction {
    private final DistributorStore store;
    private final ClaimTransaction parent;

    private final Map<Long, Set<Long>> claimed = new HashMap<>();
    private final Map<Long, Hash32> roots = new HashMap<>();
    private final List<StateMutation> mutations = new ArrayList<>();
    private final List<ClaimEvent> events = new ArrayList<>();

    private ClaimTransaction(DistributorStore store, ClaimTransaction parent) {
        this.store = store;
        this.parent = parent;
    }

    static ClaimTransaction outermost(DistributorStore store) {
        return new ClaimTransaction(store, null);
    }

    ClaimTransaction nested() {
        return new ClaimTransaction(store, this);
    }

    boolean isNested() {
        return parent != null;
    }

    boolean isClaimed(long period, long index) {
        Set<Long> mine = claimed.get(period);
        if (mine != null && mine.contains(index)) return true;
        return parent != null ? parent.isClaimed(period, index) : store.isClaimed(period, index);
    }

    Hash32 rootOf(long period) {
        Hash32 mine = roots.get(period);
        if (mine != null) return mine;
        return parent != null ? parent.rootOf(period) : store.rootOf(period);
    }

    void markClaimed(long period, long index) {
        claimed.computeIfAbsent(period, p -> new HashSet<>()).add(index);
        mutations.add(new StateMutation.IndexClaimed(period, index));
    }

    void seedRoot(long period, Hash32 root) {
        roots.put(period, root);
        mutations.add(new StateMutation.RootSeeded(period, root));
    }

    void emit(ClaimEvent event) {
        events.add(event);
    }

    /** Fold a successful nested transaction into this one. */
    void absorb(ClaimTransaction child) {
        if (child.parent != this) throw new IllegalArgumentException("not a child of this transaction");
        child.claimed.forEach((p, idx) -> claimed.computeIfAbsent(p, k -> new HashSet<>()).addAll(idx));
        roots.putAll(child.roots);
        mutations.addAll(child.mutations);
        events.addAll(child.events);
    }

    List<StateMutation> mutations() {
        return List.copyOf(mutations);
    }

    List<ClaimEvent> events() {
        return List.copyOf(events);
    }
}
