package io.opledger.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of trying to claim a fingerprint:
 *  - Accepted: this call created the ledger entry.
 *  - Rejected: the fingerprint was already claimed (a duplicate). Not an error:
 *              the caller must simply not apply its side effect.
 */
public sealed interface InsertOutcome permits InsertOutcome.Accepted, InsertOutcome.Rejected {

    Fingerprint fingerprint();

    boolean accepted();

    record Accepted(LedgerEntry entry) implements InsertOutcome {
        public Accepted {
            Objects.requireNonNull(entry, "entry");
        }

        @Override public Fingerprint fingerprint() { return entry.fingerprint(); }

        @Override public boolean accepted() { return true; }

        public long sequenceNumber() { return entry.sequenceNumber(); }
    }

    /**
     * @param existing the entry that holds the fingerprint, when known. May be
     *                 null if the backend refused the insert without telling us
     *                 who owns it.
     */
    record Rejected(Fingerprint fingerprint, LedgerEntry existing) implements InsertOutcome {
        public Rejected {
            Objects.requireNonNull(fingerprint, "fingerprint");
        }

        @Override public boolean accepted() { return false; }

        public Optional<LedgerEntry> owner() { return Optional.ofNullable(existing); }
    }
}
