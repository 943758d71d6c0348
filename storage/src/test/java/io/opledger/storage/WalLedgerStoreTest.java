package io.opledger.storage;

import io.opledger.core.BackendUnavailableException;
import io.opledger.core.EncodingException;
import io.opledger.core.Fingerprint;
import io.opledger.core.FingerprintCodec;
import io.opledger.core.InsertOutcome;
import io.opledger.core.LedgerEntry;
import io.opledger.core.audit.AuditEvent;
import io.opledger.core.audit.AuditIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class WalLedgerStoreTest {

    @TempDir Path walDir;

    private static Fingerprint fp(String recordId) {
        return FingerprintCodec.encode("Create", recordId, 1);
    }

    @Test
    void claims_survive_restart() throws Exception {
        var store1 = new WalLedgerStore(new FileWal(walDir, 1L << 60));
        var ledger1 = new Ledger(store1);
        ledger1.tryInsert(fp("a"), "alice", 1);
        ledger1.tryInsert(fp("b"), "bob", 1);
        store1.close();

        // "Crash": new instance recovers from disk
        var index = new AuditIndex();
        var ledger2 = new Ledger(new WalLedgerStore(new FileWal(walDir, 1L << 60)), index);

        assertEquals("alice", ledger2.lookup(fp("a")).orElseThrow().signer());
        assertFalse(ledger2.tryInsert(fp("a"), "mallory", 1).accepted());

        var c = assertInstanceOf(InsertOutcome.Accepted.class, ledger2.tryInsert(fp("c"), "alice", 1));
        assertEquals(3L, c.sequenceNumber());
        assertEquals(List.of(1L, 3L),
                index.recordsBy("alice").stream().map(AuditEvent::sequenceNumber).toList());
    }

    @Test
    void replay_ignores_truncated_tail() throws Exception {
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(EntryCodec.encode(new LedgerEntry(fp("a"), "alice", 1, 1)));
        wal.append(EntryCodec.encode(new LedgerEntry(fp("b"), "bob", 1, 2)));
        byte[] torn = EntryCodec.encode(new LedgerEntry(fp("c"), "carol", 1, 3));
        wal.close();
        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(torn, 0, torn.length - 5); // simulate crash mid-append
        }

        var store = new WalLedgerStore(new FileWal(walDir, 1L << 60));

        assertEquals(2, store.size());
        assertTrue(store.read(fp("c")).isEmpty(), "torn record was never acknowledged");
    }

    @Test
    void writes_after_torn_tail_survive_next_restart() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(EntryCodec.encode(new LedgerEntry(fp("a"), "alice", 1, 1)));
        byte[] torn = EntryCodec.encode(new LedgerEntry(fp("b"), "bob", 1, 2));
        wal.close();
        try (OutputStream out = Files.newOutputStream(walDir.resolve("00000001.log"), APPEND)) {
            out.write(torn, 0, 7);
        }

        var store1 = new WalLedgerStore(new FileWal(walDir, 1L << 60));
        var b = assertInstanceOf(InsertOutcome.Accepted.class, new Ledger(store1).tryInsert(fp("b"), "bob", 1));
        assertEquals(2L, b.sequenceNumber());
        store1.close();

        var store2 = new WalLedgerStore(new FileWal(walDir, 1L << 60));
        assertEquals(2, store2.size());
        assertEquals("bob", store2.read(fp("b")).orElseThrow().signer());
    }

    @Test
    void duplicate_records_in_log_keep_first_writer() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(EntryCodec.encode(new LedgerEntry(fp("a"), "alice", 1, 1)));
        wal.append(EntryCodec.encode(new LedgerEntry(fp("a"), "bob", 1, 2)));
        wal.close();

        var store = new WalLedgerStore(new FileWal(walDir, 1L << 60));

        assertEquals(1, store.size());
        assertEquals("alice", store.read(fp("a")).orElseThrow().signer());
    }

    @Test
    void replay_spans_rotated_segments() throws Exception {
        // Rotate after every record.
        var store1 = new WalLedgerStore(new FileWal(walDir, 1));
        var ledger = new Ledger(store1);
        for (int i = 0; i < 5; i++) {
            ledger.tryInsert(fp("r" + i), "s", 1);
        }
        store1.close();

        assertTrue(FileWal.segments(walDir).size() >= 5);

        var store2 = new WalLedgerStore(new FileWal(walDir, 1));
        assertEquals(5, store2.size());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L),
                store2.entries().stream().map(LedgerEntry::sequenceNumber).toList());
    }

    @Test
    void non_ascii_signer_reads_back_unchanged_after_restart() throws Exception {
        String signer = "\u00e9lodie \uD83D\uDD11";
        var store1 = new WalLedgerStore(new FileWal(walDir, 1L << 60));
        new Ledger(store1).tryInsert(fp("a"), signer, 1);
        store1.close();

        var index = new AuditIndex();
        var ledger2 = new Ledger(new WalLedgerStore(new FileWal(walDir, 1L << 60)), index);

        assertEquals(signer, ledger2.lookup(fp("a")).orElseThrow().signer());
        assertEquals(List.of(fp("a")),
                index.recordsBy(signer).stream().map(AuditEvent::fingerprint).toList());
    }

    @Test
    void unpaired_surrogate_signer_is_never_logged() throws Exception {
        var store1 = new WalLedgerStore(new FileWal(walDir, 1L << 60));
        var ledger1 = new Ledger(store1);

        assertThrows(EncodingException.class, () -> ledger1.tryInsert(fp("a"), "alice\uD800", 1));
        assertThrows(EncodingException.class,
                () -> EntryCodec.encode(new LedgerEntry(fp("a"), "alice\uD800", 1, 1)));
        assertEquals(0, store1.size());
        assertEquals(0L, Files.size(walDir.resolve("00000001.log")));

        // the fingerprint is still free for a well-formed signer, and that binding survives restart
        assertTrue(ledger1.tryInsert(fp("a"), "alice", 1).accepted());
        store1.close();
        var store2 = new WalLedgerStore(new FileWal(walDir, 1L << 60));
        assertEquals("alice", store2.read(fp("a")).orElseThrow().signer());
    }

    @Test
    void failed_append_leaves_fingerprint_unclaimed() {
        var store = new WalLedgerStore(new DownWal());
        var ledger = new Ledger(store);

        assertThrows(BackendUnavailableException.class, () -> ledger.tryInsert(fp("a"), "alice", 1));
        assertTrue(store.read(fp("a")).isEmpty());
        assertEquals(0, store.size());
    }

    /** WAL whose disk is gone. */
    private static final class DownWal implements Wal {
        @Override public void append(byte[] encodedEntry) { throw new BackendUnavailableException("disk gone"); }
        @Override public void rotateIfNeeded() { }
        @Override public Replay replay() {
            return new Replay() {
                @Override public byte[] nextPayload() { return null; }
                @Override public void close() { }
            };
        }
        @Override public void close() { }
    }
}
