// file: storage/src/main/java/io/dripline/storage/DurableDistributorStore.java
package io.dripline.storage;

import io.dripline.core.Hash32;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable {@link DistributorStore}.
 * <p>
 * Responsibilities:
 *  - Keep the root registry and claimed bitmap in memory.
 *  - On commit:
 *      1) Validate the whole list against current state (no partial apply).
 *      2) Frame it as one WAL record with the next sequence number.
 *      3) Append+fsync to the WAL.
 *      4) Apply to memory.
 *      5) Rotate the WAL segment and maybe snapshot; after a snapshot,
 *         drop the WAL segments it covers.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any).
 *      2) Replay WAL records whose sequence is above the snapshot's.
 */
public class DurableDistributorStore implements DistributorStore {
    private static final Logger log = Logger.getLogger(DurableDistributorStore.class.getName());

    private final RootRegistry registry = new RootRegistry();
    private final ClaimBitmap bitmap = new ClaimBitmap();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private long lastSequence;

    public DurableDistributorStore(Wal wal, Snapshotter snaps) {
        this(wal, snaps, new SnapshotPolicy(50_000));
    }

    public DurableDistributorStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        recover();
    }

    @Override
    public synchronized Hash32 rootOf(long period) {
        return registry.rootOf(period);
    }

    @Override
    public synchronized boolean isClaimed(long period, long index) {
        return bitmap.isClaimed(period, index);
    }

    @Override
    public synchronized long claimedCount(long period) {
        return bitmap.claimedCount(period);
    }

    @Override
    public synchronized long lastSequence() {
        return lastSequence;
    }

    @Override
    public synchronized void commit(List<StateMutation> mutations) {
        Objects.requireNonNull(mutations, "mutations");
        if (mutations.isEmpty()) return;
        validate(mutations);

        long seq = lastSequence + 1;
        // If the process crashes after append returns, recovery will still see this unit.
        wal.append(MutationCodec.encode(seq, mutations));

        mutations.forEach(this::apply);
        lastSequence = seq;

        // The unit is committed once appended; maintenance failures below are logged, not raised.
        try {
            wal.rotateIfNeeded();
            String snap = snapPolicy.maybeSnapshot(this::image, snaps);
            if (snap != null) {
                wal.checkpoint();
                log.info(() -> "wrote snapshot " + snap + " at sequence " + seq);
            }
        } catch (UncheckedIOException e) {
            log.log(Level.WARNING, "WAL/snapshot maintenance failed after sequence " + seq
                    + "; the WAL still holds every committed unit", e);
        }
    }

    /** Write a snapshot now, regardless of policy, and drop the WAL segments it covers. Used on clean shutdown. */
    public synchronized String snapshotNow() {
        String snap = snaps.writeSnapshot(image());
        wal.checkpoint();
        return snap;
    }

    private void validate(List<StateMutation> mutations) {
        Set<Long> seededHere = new HashSet<>();
        Map<Long, Set<Long>> claimedHere = new HashMap<>();
        for (StateMutation m : mutations) {
            if (m instanceof StateMutation.RootSeeded r) {
                if (registry.isSet(r.period()) || !seededHere.add(r.period())) {
                    throw new IllegalStateException("root already set for period " + r.period());
                }
            } else if (m instanceof StateMutation.IndexClaimed c) {
                boolean dup = !claimedHere.computeIfAbsent(c.period(), p -> new HashSet<>()).add(c.index());
                if (dup || bitmap.isClaimed(c.period(), c.index())) {
                    throw new IllegalStateException(
                            "index " + c.index() + " already claimed for period " + c.period());
                }
            }
        }
    }

    private void apply(StateMutation m) {
        if (m instanceof StateMutation.RootSeeded r) {
            registry.put(r.period(), r.root());
        } else if (m instanceof StateMutation.IndexClaimed c) {
            bitmap.markClaimed(c.period(), c.index());
        }
    }

    private Snapshotter.Image image() {
        List<Snapshotter.Word> words = new ArrayList<>();
        bitmap.forEachWord((period, word, bits) -> words.add(new Snapshotter.Word(period, word, bits)));
        return new Snapshotter.Image(lastSequence, Map.copyOf(registry.view()), words);
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL units in order, skipping those already in the snapshot.
     */
    private void recover() {
        Snapshotter.Image loaded = snaps.loadLatest();
        if (loaded != null) {
            loaded.roots().forEach(registry::put);
            for (Snapshotter.Word w : loaded.words()) {
                bitmap.loadWord(w.period(), w.word(), w.bits());
            }
            lastSequence = loaded.sequence();
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                MutationCodec.Entry entry = MutationCodec.decode(payload);
                if (entry.sequence() <= lastSequence) continue;
                entry.mutations().forEach(this::apply);
                lastSequence = entry.sequence();
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("Recovery failed", e);
        }
        int n = replayed;
        log.info(() -> "recovered store at sequence " + lastSequence + " (" + registry.size()
                + " roots, " + n + " WAL units replayed)");
    }
}
