// file: src/main/java/io/opledger/core/audit/AuditIndex.java
package io.opledger.core.audit;

import io.opledger.core.Fingerprint;
import io.opledger.core.LedgerEntry;
import io.opledger.core.LedgerObserver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only audit view over accepted ledger entries.
 * <p>
 * Answers two questions:
 *  - eventFor(F):  who wrote fingerprint F?
 *  - recordsBy(S): what did signer S write, in sequence order?
 * <p>
 * Layout:
 *  - byFingerprint: fingerprint -> event
 *  - bySigner:      signer -> fingerprints sorted by sequence number
 * <p>
 * The ledger publishes entries in sequence order while holding its own lock,
 * so the common case is an append at the tail. Entries replayed out of order
 * (e.g. during recovery from a store that is not sorted) are placed at their
 * sorted position. Publishing the same fingerprint twice is a no-op.
 */
public final class AuditIndex implements LedgerObserver {

    private final Map<Fingerprint, AuditEvent> byFingerprint = new HashMap<>();
    private final Map<String, List<Fingerprint>> bySigner = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void onAccepted(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry");
        AuditEvent event = AuditEvent.of(entry);

        lock.writeLock().lock();
        try {
            if (byFingerprint.putIfAbsent(event.fingerprint(), event) != null) {
                return; // already indexed
            }
            List<Fingerprint> list = bySigner.computeIfAbsent(event.signer(), s -> new ArrayList<>());
            list.add(insertionPoint(list, event.sequenceNumber()), event.fingerprint());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Events for a signer, ascending by sequence number. Empty if none. */
    public List<AuditEvent> recordsBy(String signer) {
        Objects.requireNonNull(signer, "signer");
        lock.readLock().lock();
        try {
            List<Fingerprint> fps = bySigner.get(signer);
            if (fps == null) {
                return List.of();
            }
            List<AuditEvent> out = new ArrayList<>(fps.size());
            for (Fingerprint fp : fps) {
                out.add(byFingerprint.get(fp));
            }
            return List.copyOf(out);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AuditEvent> eventFor(Fingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byFingerprint.get(fingerprint));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of indexed events. */
    public int size() {
        lock.readLock().lock();
        try {
            return byFingerprint.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Index at which an event with sequence number {@code seq} keeps the list sorted.
     * Fast path: tail append.
     */
    private int insertionPoint(List<Fingerprint> list, long seq) {
        int n = list.size();
        if (n == 0 || byFingerprint.get(list.get(n - 1)).sequenceNumber() < seq) {
            return n;
        }
        int lo = 0;
        int hi = n;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (byFingerprint.get(list.get(mid)).sequenceNumber() < seq) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
