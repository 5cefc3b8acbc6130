// file: server/src/main/java/io/dripline/server/DistributorService.java
package io.dripline.server;

import io.dripline.core.Address;
import io.dripline.core.DistributorException;
import io.dripline.core.Hash32;
import io.dripline.core.Uint256;
import io.dripline.core.access.AccessControl;
import io.dripline.core.ledger.TokenLedger;
import io.dripline.core.merkle.ClaimLeaf;
import io.dripline.core.merkle.MerkleProofs;
import io.dripline.server.events.ClaimEvent;
import io.dripline.server.events.ClaimListener;
import io.dripline.storage.DistributorStore;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The distributor engine: seeding, single and batched claims, and read queries.
 *
 * Responsibilities:
 *  - Gate seeding on the owner and fund each period from a funding source.
 *  - Verify claims against the period root and pay them out exactly once.
 *  - Keep every call all-or-nothing, including calls that the ledger makes
 *    back into this service while a transfer is in flight.
 *  - Deliver {@link ClaimEvent}s after commit, once per claimed index.
 *
 * Each call runs in a {@link ClaimTransaction}. The claimed bit is staged before
 * the ledger is asked to pay, so a ledger that re-enters {@link #claim} for the
 * same index on the same thread sees it as claimed. Only the outermost call
 * commits to the {@link DistributorStore}, as one atomic unit.
 */
public final class DistributorService {
    private static final Logger log = Logger.getLogger(DistributorService.class.getName());

    /** Largest number of periods a single range query may cover. */
    public static final int MAX_QUERY_SPAN = 10_000;

    /** One entry of a batched claim. */
    public record BatchEntry(long index, long period, BigInteger balance, List<Hash32> proof) {
        public BatchEntry {
            Objects.requireNonNull(balance, "balance");
            proof = List.copyOf(Objects.requireNonNull(proof, "proof"));
        }
    }

    /** Outcome of a committed batch. */
    public record BatchResult(Address account, List<ClaimEvent> claimed, BigInteger total) {}

    private final DistributorStore store;
    private final TokenLedger ledger;
    private final AccessControl access;
    private final Address custody;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<ClaimTransaction> open = new ArrayDeque<>();
    private final List<ClaimListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param ledger  ledger bound to {@code custody}; pays claims and pulls funding
     * @param custody the distributor's own ledger address, target of funding pulls
     */
    public DistributorService(DistributorStore store, TokenLedger ledger, AccessControl access, Address custody) {
        this.store = Objects.requireNonNull(store, "store");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.access = Objects.requireNonNull(access, "access");
        this.custody = Objects.requireNonNull(custody, "custody");
    }

    public void addListener(ClaimListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public Address custody() {
        return custody;
    }

    // ---------- seeding ----------

    /**
     * Publish the root for {@code period} and pull {@code totalAllocation} from
     * {@code fundingSource} into custody. The root is stored only if the pull succeeds.
     */
    public void seed(Address caller, long period, Hash32 root, BigInteger totalAllocation, Address fundingSource) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(fundingSource, "fundingSource");
        requireNonNegative(period, "period");
        Uint256.require(totalAllocation, "totalAllocation");
        if (root.isZero()) throw new IllegalArgumentException("root must not be zero");

        atomically(tx -> {
            access.requireOwner(caller);
            if (!tx.rootOf(period).isZero()) throw DistributorException.rootAlreadySet(period);

            tx.seedRoot(period, root);
            if (!ledger.transferFrom(fundingSource, custody, totalAllocation)) {
                log.warning(() -> "funding pull of " + totalAllocation + " from " + fundingSource
                        + " for period " + period + " refused");
                throw DistributorException.transferFailed(
                        "transferFrom of " + totalAllocation + " from " + fundingSource);
            }
            return null;
        });
        log.info(() -> "seeded period " + period + " root=" + root.toHex() + " allocation=" + totalAllocation);
    }

    // ---------- claims ----------

    /** Claim one entitlement and pay {@code balance} to {@code account}. */
    public ClaimEvent claim(long index, Address account, long period, BigInteger balance, List<Hash32> proof) {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(proof, "proof");

        ClaimEvent ev = atomically(tx -> {
            ClaimEvent staged = stageClaim(tx, index, account, period, balance, proof);
            if (!ledger.transfer(account, balance)) {
                log.warning(() -> "payout of " + balance + " to " + account + " refused");
                throw DistributorException.transferFailed("transfer of " + balance + " to " + account);
            }
            return staged;
        });
        log.info(() -> "claimed period " + period + " index " + index + " by " + account + " amount=" + balance);
        return ev;
    }

    /**
     * Claim several entitlements of one account, possibly across periods, with a
     * single payout of their sum. Any failing entry aborts the whole batch.
     */
    public BatchResult claimBatch(Address account, List<BatchEntry> entries) {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(entries, "entries");
        if (entries.isEmpty()) throw new IllegalArgumentException("batch must contain at least one entry");

        BatchResult result = atomically(tx -> {
            List<ClaimEvent> claimed = new ArrayList<>(entries.size());
            BigInteger total = BigInteger.ZERO;
            for (BatchEntry e : entries) {
                claimed.add(stageClaim(tx, e.index(), account, e.period(), e.balance(), e.proof()));
                total = total.add(e.balance());
            }
            Uint256.require(total, "batch total");

            BigInteger payout = total;
            if (!ledger.transfer(account, payout)) {
                log.warning(() -> "batch payout of " + payout + " to " + account + " refused");
                throw DistributorException.transferFailed("transfer of " + payout + " to " + account);
            }
            return new BatchResult(account, List.copyOf(claimed), payout);
        });
        log.info(() -> "batch claim by " + account + ": " + entries.size() + " entries, total=" + result.total());
        return result;
    }

    private ClaimEvent stageClaim(ClaimTransaction tx, long index, Address account, long period,
                                  BigInteger balance, List<Hash32> proof) {
        if (tx.isClaimed(period, index)) {
            log.fine(() -> "refused: period " + period + " index " + index + " already claimed");
            throw DistributorException.alreadyClaimed(period, index);
        }
        requireNonNegative(period, "period");
        Uint256.require(balance, "balance");
        ClaimLeaf leaf = new ClaimLeaf(index, account, balance);

        if (!MerkleProofs.verify(proof, tx.rootOf(period), leaf.hash())) {
            log.fine(() -> "refused: bad proof for period " + period + " index " + index);
            throw DistributorException.invalidProof(period, index);
        }

        tx.markClaimed(period, index);
        ClaimEvent ev = new ClaimEvent(period, index, account, balance);
        tx.emit(ev);
        return ev;
    }

    // ---------- queries ----------

    public boolean isClaimed(long period, long index) {
        requireNonNegative(period, "period");
        requireNonNegative(index, "index");
        return read(() -> store.isClaimed(period, index));
    }

    /** Stored root for {@code period}, or {@link Hash32#ZERO} if none was published. */
    public Hash32 rootOf(long period) {
        requireNonNegative(period, "period");
        return read(() -> store.rootOf(period));
    }

    /**
     * Claimed flags for pairs {@code (periodBegin + i, indices[i])}.
     * The range is inclusive, non-empty, and must hold exactly {@code indices.size()} periods.
     */
    public List<Boolean> claimStatus(List<Long> indices, long periodBegin, long periodEnd) {
        Objects.requireNonNull(indices, "indices");
        requireNonNegative(periodBegin, "periodBegin");
        long periods = periodEnd < periodBegin ? 0 : periodEnd - periodBegin + 1;
        if (periods == 0 || periods != indices.size()) {
            throw DistributorException.lengthMismatch(indices.size(), periods);
        }
        requireSpan(periods);
        for (Long idx : indices) {
            if (idx == null) throw new IllegalArgumentException("indices must not contain null");
            requireNonNegative(idx, "index");
        }

        return read(() -> {
            List<Boolean> out = new ArrayList<>(indices.size());
            for (int i = 0; i < indices.size(); i++) {
                out.add(store.isClaimed(periodBegin + i, indices.get(i)));
            }
            return out;
        });
    }

    /** Roots for every period in {@code [periodBegin, periodEnd]}, ZERO where unset. */
    public List<Hash32> merkleRoots(long periodBegin, long periodEnd) {
        requireNonNegative(periodBegin, "periodBegin");
        if (periodEnd < periodBegin) {
            throw new IllegalArgumentException("periodEnd " + periodEnd + " is before periodBegin " + periodBegin);
        }
        long periods = periodEnd - periodBegin + 1;
        requireSpan(periods);

        return read(() -> {
            List<Hash32> out = new ArrayList<>((int) periods);
            for (long p = periodBegin; p <= periodEnd; p++) {
                out.add(store.rootOf(p));
            }
            return out;
        });
    }

    // ---------- ownership ----------

    public Address owner() {
        return access.owner();
    }

    public Optional<Address> pendingOwner() {
        return access.pendingOwner();
    }

    public void transferOwnership(Address caller, Address newOwner) {
        access.transferOwnership(caller, newOwner);
    }

    public void proposeOwner(Address caller, Address candidate) {
        access.proposeOwner(caller, candidate);
    }

    public void acceptOwnership(Address caller) {
        access.acceptOwnership(caller);
    }

    // ---------- transactions ----------

    private <T> T atomically(Function<ClaimTransaction, T> body) {
        lock.lock();
        try {
            ClaimTransaction parent = open.peek();
            ClaimTransaction tx = parent == null ? ClaimTransaction.outermost(store) : parent.nested();
            open.push(tx);
            T result;
            try {
                result = body.apply(tx);
            } finally {
                open.pop();
            }

            if (tx.isNested()) {
                parent.absorb(tx);
                return result;
            }
            store.commit(tx.mutations());
            publish(tx.events());
            return result;
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    private void publish(List<ClaimEvent> events) {
        for (ClaimEvent ev : events) {
            for (ClaimListener l : listeners) {
                try {
                    l.onClaimed(ev);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "claim listener failed for period " + ev.period()
                            + " index " + ev.index(), e);
                }
            }
        }
    }

    private static void requireNonNegative(long v, String name) {
        if (v < 0) throw new IllegalArgumentException(name + " must be >= 0, got " + v);
    }

    private static void requireSpan(long periods) {
        if (periods > MAX_QUERY_SPAN) {
            throw new IllegalArgumentException("range covers " + periods + " periods, max is " + MAX_QUERY_SPAN);
        }
    }
}
