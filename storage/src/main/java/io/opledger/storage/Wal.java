// file: src/main/java/io/opledger/storage/Wal.java
package io.opledger.storage;

import java.io.IOException;

/**
 * Durable log of accepted ledger entries, one {@link EntryCodec} record each.
 * <p>
 * A fingerprint counts as claimed only once its record is in the log, so:
 *  - {@link #append} returns only after the record is on disk. The caller makes
 *    the entry visible afterwards, never before.
 *  - A failed append throws {@link io.opledger.core.BackendUnavailableException}
 *    and leaves nothing behind that replay would treat as a claim.
 *  - Replay yields the claims in the order they were appended and ends at the
 *    first record it cannot verify. Such a record was never acknowledged.
 */
public interface Wal extends AutoCloseable {

    /** Append one encoded ledger entry and force it to disk. */
    void append(byte[] encodedEntry);

    /**
     * Start a new segment if the current one has grown past its size limit.
     * Stores call this after a successful append; entries already written are unaffected.
     */
    void rotateIfNeeded();

    /** Replay every entry payload written so far, oldest segment first. */
    Replay replay();

    /** One pass over the logged entries during recovery. */
    interface Replay extends AutoCloseable {

        /** Payload for {@link EntryCodec#decode}, or null once no verified record remains. */
        byte[] nextPayload();

        @Override
        void close() throws IOException;
    }
}
