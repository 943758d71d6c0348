package io.opledger.core.audit;

import io.opledger.core.Fingerprint;
import io.opledger.core.LedgerEntry;

/**
 * Read-only projection of a ledger entry for history queries.
 * Derived data: the ledger remains the source of truth.
 */
public record AuditEvent(String signer, Fingerprint fingerprint, long sequenceNumber, long nonce) {

    public static AuditEvent of(LedgerEntry e) {
        return new AuditEvent(e.signer(), e.fingerprint(), e.sequenceNumber(), e.nonce());
    }
}
