// file: server/src/main/java/io/opledger/server/RegistryService.java
package io.opledger.server;

import io.opledger.core.Fingerprint;
import io.opledger.core.FingerprintCodec;
import io.opledger.core.InsertOutcome;
import io.opledger.core.LedgerEntry;
import io.opledger.core.OperationKey;
import io.opledger.core.audit.AuditEvent;
import io.opledger.core.audit.AuditIndex;
import io.opledger.storage.Ledger;
import io.opledger.storage.LedgerStore;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Public face of the registry: encode, coalesce, record, query.
 *
 * Responsibilities:
 *  - Turn (operationKind, recordId, nonce) into a Fingerprint. Invalid input
 *    fails with EncodingException before anything touches the ledger.
 *  - Route writes through the SubmissionCoalescer, applying the default wait
 *    limit when the caller gives none.
 *  - Serve reads straight from the Ledger and AuditIndex (no coalescing).
 *  - Log every outcome as "accepted" or "duplicate".
 */
public final class RegistryService implements AutoCloseable {
    private static final Logger log = Logger.getLogger(RegistryService.class.getName());

    private final Ledger ledger;
    private final AuditIndex audit;
    private final SubmissionCoalescer coalescer;
    private final Duration defaultTimeout; // null = wait indefinitely

    /**
     * @param ledger         must already publish to {@code audit}
     * @param defaultTimeout wait limit for {@link #submit(String, String, long, String)}; null for none
     */
    public RegistryService(Ledger ledger, AuditIndex audit, SubmissionCoalescer coalescer, Duration defaultTimeout) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.coalescer = Objects.requireNonNull(coalescer, "coalescer");
        this.defaultTimeout = defaultTimeout;
    }

    /** Wire an AuditIndex, Ledger and coalescer on top of {@code store}. */
    public static RegistryService create(LedgerStore store, int writerThreads, Duration defaultTimeout) {
        var audit = new AuditIndex();
        var ledger = new Ledger(store, audit);
        return new RegistryService(ledger, audit, new SubmissionCoalescer(ledger, writerThreads), defaultTimeout);
    }

    // ---------- writes ----------

    public boolean submit(String operationKind, String recordId, long nonce, String signer) {
        return submit(operationKind, recordId, nonce, signer, defaultTimeout);
    }

    public boolean submit(String operationKind, String recordId, long nonce, String signer, Duration timeout) {
        return record(operationKind, recordId, nonce, signer, timeout).accepted();
    }

    /**
     * Same as submit, but returns the full outcome (fingerprint, sequence
     * number, current owner). Used by the HTTP layer.
     */
    public InsertOutcome record(String operationKind, String recordId, long nonce, String signer, Duration timeout) {
        Fingerprint fp = FingerprintCodec.encode(OperationKey.of(operationKind, recordId, nonce));
        InsertOutcome outcome = coalescer.submit(fp, signer, nonce, timeout);

        if (outcome instanceof InsertOutcome.Accepted a) {
            log.info(() -> "accepted " + fp + " signer=" + signer + " seq=" + a.sequenceNumber());
        } else {
            log.info(() -> "duplicate " + fp + " signer=" + signer);
        }
        return outcome;
    }

    // ---------- reads ----------

    public Optional<String> signerOf(String operationKind, String recordId, long nonce) {
        return ledger.lookup(fingerprintOf(operationKind, recordId, nonce)).map(LedgerEntry::signer);
    }

    public List<AuditEvent> historyOf(String signer) {
        return audit.recordsBy(signer);
    }

    public Fingerprint fingerprintOf(String operationKind, String recordId, long nonce) {
        return FingerprintCodec.encode(operationKind, recordId, nonce);
    }

    public Optional<AuditEvent> eventFor(String operationKind, String recordId, long nonce) {
        return audit.eventFor(fingerprintOf(operationKind, recordId, nonce));
    }

    public int pendingCount() {
        return coalescer.pendingCount();
    }

    public int ledgerSize() {
        return ledger.size();
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    /** Stops the writer pool. The LedgerStore belongs to the caller. */
    @Override
    public void close() {
        coalescer.close();
    }
}
