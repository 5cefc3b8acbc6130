// file: server/src/main/java/io/dripline/server/events/ClaimFeed.java
package io.dripline.server.events;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory journal of claim notifications for pollers (indexers, UIs).
 * <p>
 * Each event gets a sequence number starting at 1. Pollers ask for events
 * after the last sequence they saw; once more than {@code capacity} events
 * have been recorded, the oldest are dropped and a poller that fell behind
 * sees a gap in sequence numbers.
 * <p>
 * Not persisted: after a restart numbering starts again at 1.
 */
public final class ClaimFeed implements ClaimListener {

    /** One journal entry. */
    public record Entry(long seq, ClaimEvent event) {}

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private long nextSeq = 1;

    public ClaimFeed(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
    }

    @Override
    public synchronized void onClaimed(ClaimEvent event) {
        entries.addLast(new Entry(nextSeq++, event));
        if (entries.size() > capacity) entries.removeFirst();
    }

    /** Up to {@code limit} entries with seq > {@code after}, oldest first. */
    public synchronized List<Entry> since(long after, int limit) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        List<Entry> out = new ArrayList<>(Math.min(limit, entries.size()));
        for (Entry e : entries) {
            if (e.seq() <= after) continue;
            out.add(e);
            if (out.size() >= limit) break;
        }
        return out;
    }

    /** Sequence of the newest entry, 0 if none yet. */
    public synchronized long lastSeq() {
        return nextSeq - 1;
    }
}
