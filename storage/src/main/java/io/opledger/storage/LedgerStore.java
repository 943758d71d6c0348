package io.opledger.storage;

import io.opledger.core.Fingerprint;
import io.opledger.core.LedgerEntry;

import java.util.List;
import java.util.Optional;

/**
 * Durability backend used by {@link Ledger}.
 * <p>
 * Contract:
 *  - insertIfAbsent() is atomic: for a given fingerprint at most one call ever
 *    returns true, even across Ledger instances sharing the store.
 *  - An entry is visible to read() only after it is durable for this backend.
 *  - Backend failures surface as BackendUnavailableException and leave the
 *    fingerprint unclaimed.
 * <p>
 * Replication of the store itself is the backend's business and is not
 * modelled here.
 */
public interface LedgerStore extends AutoCloseable {

    /**
     * Store {@code entry} if no entry exists for its fingerprint.
     *
     * @return true if stored, false if the fingerprint was already present
     */
    boolean insertIfAbsent(LedgerEntry entry);

    /** Point-in-time read. */
    Optional<LedgerEntry> read(Fingerprint fingerprint);

    /** Snapshot of every entry, ascending by sequence number. Used for recovery. */
    List<LedgerEntry> entries();

    int size();

    @Override
    default void close() throws Exception {
        // nothing to release by default
    }
}
