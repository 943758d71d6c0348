package io.opledger.storage;

import io.opledger.core.FingerprintCodec;
import io.opledger.core.LedgerEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTest {

    @TempDir Path walDir;

    private static byte[] record(String recordId, long seq) {
        return EntryCodec.encode(new LedgerEntry(FingerprintCodec.encode("Create", recordId, 1), "s", 1, seq));
    }

    private static List<Long> replaySequences(Wal wal) throws Exception {
        List<Long> seqs = new ArrayList<>();
        try (Wal.Replay r = wal.replay()) {
            for (byte[] p; (p = r.nextPayload()) != null; ) {
                seqs.add(EntryCodec.decode(p).sequenceNumber());
            }
        }
        return seqs;
    }

    @Test
    void reader_walks_segments_in_order() throws Exception {
        var wal = new FileWal(walDir, 1); // every append rolls over
        for (int i = 1; i <= 3; i++) {
            wal.append(record("r" + i, i));
            wal.rotateIfNeeded();
        }
        wal.close();

        assertEquals(List.of("00000001.log", "00000002.log", "00000003.log", "00000004.log"),
                FileWal.segments(walDir).stream().map(p -> p.getFileName().toString()).toList());
        assertEquals(List.of(1L, 2L, 3L), replaySequences(new FileWal(walDir, 1)));
    }

    @Test
    void reader_stops_at_bad_checksum() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(record("a", 1));
        byte[] bad = record("b", 2);
        bad[bad.length - 1] ^= 0x01; // payload no longer matches crc
        wal.append(bad);
        wal.append(record("c", 3));

        assertEquals(List.of(1L), replaySequences(wal));
        wal.close();
    }

    @Test
    void reopening_cuts_off_a_torn_record() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        byte[] whole = record("a", 1);
        wal.append(whole);
        wal.close();
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(record("b", 2), 0, 9);
        }

        var reopened = new FileWal(walDir, 1L << 60);
        assertEquals(whole.length, Files.size(seg));

        reopened.append(record("c", 3));
        assertEquals(List.of(1L, 3L), replaySequences(reopened));
        reopened.close();
    }

    @Test
    void rotate_threshold_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new FileWal(walDir, 0));
    }
}
