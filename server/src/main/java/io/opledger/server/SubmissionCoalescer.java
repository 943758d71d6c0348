// file: server/src/main/java/io/opledger/server/SubmissionCoalescer.java
package io.opledger.server;

import io.opledger.core.Fingerprint;
import io.opledger.core.InsertOutcome;
import io.opledger.core.LedgerEntry;
import io.opledger.storage.Ledger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collapses concurrent submissions of the same fingerprint into one Ledger write.
 *
 * Contract:
 *  - The first caller for a fingerprint (the owner) schedules the write on the
 *    writer executor; everyone arriving while it is in flight attaches to the
 *    same future.
 *  - The owner gets the Ledger outcome unchanged. Attached callers always get
 *    Rejected: if the owner won, the rejection carries the owner's entry.
 *  - The pending entry is removed before the future completes, so a caller
 *    arriving after completion starts a fresh write (which the Ledger rejects)
 *    instead of reusing a stale Accepted.
 *  - A failed write is rethrown to every waiter; the fingerprint stays unclaimed.
 *  - Timing out only abandons the wait. The write runs to completion.
 */
public final class SubmissionCoalescer implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SubmissionCoalescer.class.getName());

    private final Ledger ledger;
    private final ExecutorService writers;
    private final ConcurrentHashMap<Fingerprint, CompletableFuture<InsertOutcome>> pending =
            new ConcurrentHashMap<>();

    public SubmissionCoalescer(Ledger ledger, int writerThreads) {
        this(ledger, Executors.newFixedThreadPool(writerThreads, r -> {
            Thread t = new Thread(r, "ledger-writer");
            t.setDaemon(true);
            return t;
        }));
    }

    public SubmissionCoalescer(Ledger ledger, ExecutorService writers) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.writers = Objects.requireNonNull(writers, "writers");
    }

    /** Submit and wait without a limit. */
    public InsertOutcome submit(Fingerprint fingerprint, String signer, long nonce) {
        return submit(fingerprint, signer, nonce, null);
    }

    /**
     * Submit and wait at most {@code timeout} (null means no limit).
     *
     * @throws CoalescerTimeoutException if the limit elapsed first
     * @throws IllegalArgumentException  if signer is blank or not exact UTF-8, or timeout negative
     */
    public InsertOutcome submit(Fingerprint fingerprint, String signer, long nonce, Duration timeout) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        LedgerEntry.signerBytes(signer);
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }

        CompletableFuture<InsertOutcome> mine = new CompletableFuture<>();
        CompletableFuture<InsertOutcome> inFlight = pending.putIfAbsent(fingerprint, mine);

        if (inFlight != null) {
            log.fine(() -> "attached to in-flight submission " + fingerprint);
            return asAttached(fingerprint, await(inFlight, fingerprint, timeout));
        }

        try {
            writers.execute(() -> write(fingerprint, signer, nonce, mine));
        } catch (RejectedExecutionException e) {
            pending.remove(fingerprint, mine);
            IllegalStateException closed = new IllegalStateException("coalescer is closed", e);
            mine.completeExceptionally(closed);
            throw closed;
        }
        return await(mine, fingerprint, timeout);
    }

    /** Number of fingerprints with a write in flight. */
    public int pendingCount() {
        return pending.size();
    }

    /** Stop accepting writes and wait briefly for in-flight ones. */
    @Override
    public void close() {
        writers.shutdown();
        try {
            if (!writers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warning("ledger writers still busy after 5s; " + pending.size() + " submissions pending");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.log(Level.WARNING, "interrupted while draining ledger writers", e);
        }
    }

    private void write(Fingerprint fingerprint, String signer, long nonce,
                       CompletableFuture<InsertOutcome> future) {
        InsertOutcome outcome;
        try {
            outcome = ledger.tryInsert(fingerprint, signer, nonce);
        } catch (Throwable t) {
            pending.remove(fingerprint, future);
            future.completeExceptionally(t);
            return;
        }
        pending.remove(fingerprint, future);
        future.complete(outcome);
    }

    private static InsertOutcome asAttached(Fingerprint fingerprint, InsertOutcome outcome) {
        if (outcome instanceof InsertOutcome.Accepted a) {
            return new InsertOutcome.Rejected(fingerprint, a.entry());
        }
        return outcome;
    }

    private static InsertOutcome await(CompletableFuture<InsertOutcome> future,
                                       Fingerprint fingerprint,
                                       Duration timeout) {
        try {
            return timeout == null
                    ? future.get()
                    : future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new CoalescerTimeoutException(
                    "no outcome for " + fingerprint + " within " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for " + fingerprint, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("ledger write failed for " + fingerprint, cause);
        }
    }
}
