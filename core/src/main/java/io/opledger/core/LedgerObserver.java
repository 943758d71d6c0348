package io.opledger.core;

/**
 * Receives every accepted ledger entry exactly once.
 * <p>
 * Called synchronously on the ledger's write path, before the writer sees
 * Accepted, so implementations must be fast and must not call back into the ledger.
 */
@FunctionalInterface
public interface LedgerObserver {
    void onAccepted(LedgerEntry entry);
}
