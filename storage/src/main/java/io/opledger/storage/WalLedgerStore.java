package io.opledger.storage;

import io.opledger.core.BackendUnavailableException;
import io.opledger.core.Fingerprint;
import io.opledger.core.LedgerEntry;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ledger store backed by a local write-ahead log.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: fingerprint -> LedgerEntry.
 *  - On insert:
 *      1) Reject if the fingerprint is already in memory.
 *      2) Serialize the entry and append+fsync it to the WAL.
 *      3) Only then publish it in memory.
 *      4) Rotate WAL segment if needed.
 * <p>
 *  - On startup: replay the WAL. The first record per fingerprint wins; later
 *    records for the same fingerprint are ignored.
 * <p>
 * Because the WAL write precedes the in-memory claim, a crash can never leave
 * a fingerprint claimed in memory but missing on disk. A record torn by a crash
 * was never acknowledged, and recovery treats it as absent.
 */
public class WalLedgerStore implements LedgerStore {
    private static final Logger log = Logger.getLogger(WalLedgerStore.class.getName());

    private final Map<Fingerprint, LedgerEntry> mem = new ConcurrentHashMap<>();
    private final Wal wal;

    public WalLedgerStore(Wal wal) {
        this.wal = Objects.requireNonNull(wal, "wal");
        recover();
    }

    @Override
    public synchronized boolean insertIfAbsent(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (mem.containsKey(entry.fingerprint())) {
            return false;
        }

        // append + fsync; throws BackendUnavailableException without touching memory
        wal.append(EntryCodec.encode(entry));
        mem.put(entry.fingerprint(), entry);

        try {
            wal.rotateIfNeeded();
        } catch (BackendUnavailableException e) {
            // The entry is already durable; the next append will report the broken segment.
            log.log(Level.WARNING, "WAL rotation failed after durable insert", e);
        }
        return true;
    }

    @Override
    public Optional<LedgerEntry> read(Fingerprint fingerprint) {
        return Optional.ofNullable(mem.get(fingerprint));
    }

    @Override
    public List<LedgerEntry> entries() {
        return mem.values().stream()
                .sorted(Comparator.comparingLong(LedgerEntry::sequenceNumber))
                .toList();
    }

    @Override
    public int size() {
        return mem.size();
    }

    @Override
    public void close() throws Exception {
        wal.close();
    }

    private void recover() {
        int replayed = 0;
        int duplicates = 0;
        try (Wal.Replay r = wal.replay()) {
            for (byte[] payload; (payload = r.nextPayload()) != null; ) {
                LedgerEntry e = EntryCodec.decode(payload);
                if (mem.putIfAbsent(e.fingerprint(), e) == null) {
                    replayed++;
                } else {
                    duplicates++;
                }
            }
        } catch (Exception e) {
            throw new BackendUnavailableException("Ledger recovery failed", e);
        }
        log.info(() -> "ledger WAL replay: " + mem.size() + " entries");
        if (duplicates > 0) {
            log.warning("ledger WAL replay ignored " + duplicates + " duplicate records (" + replayed + " applied)");
        }
    }
}
