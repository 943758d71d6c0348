// file: src/main/java/io/opledger/storage/Ledger.java
package io.opledger.storage;

import io.opledger.core.Fingerprint;
import io.opledger.core.InsertOutcome;
import io.opledger.core.LedgerEntry;
import io.opledger.core.LedgerObserver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Write-once ledger: fingerprint -> (signer, nonce, sequence number).
 * <p>
 * Semantics:
 *  - tryInsert():
 *      * exactly one call per fingerprint ever returns Accepted; the winner's
 *        signer is bound to the fingerprint for good,
 *      * later or losing calls return Rejected, carrying the existing entry,
 *      * check and insert run inside one critical section (this object's monitor),
 *        and the store's own insertIfAbsent is atomic too, so a second Ledger
 *        over the same store cannot double-accept either.
 *  - Sequence numbers:
 *      * assigned only to accepted inserts, strictly increasing, never reused,
 *      * a store failure consumes neither the fingerprint nor a number.
 *  - Observers see every accepted entry exactly once, in sequence order, before
 *    the writer sees Accepted.
 *  - lookup() is a plain read against the store and never takes the lock.
 * <p>
 * On construction the ledger recovers from the store: the counter resumes
 * after the highest stored sequence number and existing entries are replayed
 * to the observers.
 */
public final class Ledger {
    private static final Logger log = Logger.getLogger(Ledger.class.getName());

    private final LedgerStore store;
    private final List<LedgerObserver> observers;
    private long nextSequence;

    public Ledger(LedgerStore store, LedgerObserver... observers) {
        this(store, List.of(observers));
    }

    public Ledger(LedgerStore store, List<LedgerObserver> observers) {
        this.store = Objects.requireNonNull(store, "store");
        this.observers = List.copyOf(observers);
        this.nextSequence = recover();
    }

    /**
     * Claim {@code fingerprint} for {@code signer}.
     *
     * @throws IllegalArgumentException if signer is blank or not exact UTF-8
     * @throws io.opledger.core.BackendUnavailableException if the store cannot be written
     */
    public synchronized InsertOutcome tryInsert(Fingerprint fingerprint, String signer, long nonce) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        LedgerEntry.signerBytes(signer);

        Optional<LedgerEntry> existing = store.read(fingerprint);
        if (existing.isPresent()) {
            return new InsertOutcome.Rejected(fingerprint, existing.get());
        }

        LedgerEntry entry = new LedgerEntry(fingerprint, signer, nonce, nextSequence);
        if (!store.insertIfAbsent(entry)) {
            // Someone wrote to the store without going through this ledger.
            log.warning(() -> "store already held " + fingerprint + " although lookup missed it");
            return new InsertOutcome.Rejected(fingerprint, store.read(fingerprint).orElse(null));
        }
        nextSequence++;

        publish(entry);
        return new InsertOutcome.Accepted(entry);
    }

    public Optional<LedgerEntry> lookup(Fingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        return store.read(fingerprint);
    }

    /** Number of accepted entries. */
    public int size() {
        return store.size();
    }

    private void publish(LedgerEntry entry) {
        for (LedgerObserver o : observers) {
            o.onAccepted(entry);
        }
    }

    /** Replay stored entries to observers and return the next free sequence number. */
    private long recover() {
        long max = 0;
        List<LedgerEntry> existing = store.entries();
        for (LedgerEntry e : existing) {
            max = Math.max(max, e.sequenceNumber());
            publish(e);
        }
        if (!existing.isEmpty()) {
            log.info("ledger recovered " + existing.size() + " entries, next sequence " + (max + 1));
        }
        return max + 1;
    }
}
