// file: src/main/java/io/opledger/storage/FileWal.java
package io.opledger.storage;

import io.opledger.core.BackendUnavailableException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;


/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - truncates a torn record left at its tail by a crash,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - on I/O failure truncates the segment back to where the record started,
 *        so a half-written record cannot hide later ones from recovery.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - replay():
 *      - walks all segments in name order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;
    // Set when a failed append could not be rolled back; the segment tail is unknown.
    private boolean broken = false;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] encodedEntry) {
        if (broken) {
            throw new BackendUnavailableException("WAL segment " + current + " is in an unknown state");
        }
        long before = writtenInSegment;
        try {
            ch.write(ByteBuffer.wrap(encodedEntry), before);
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment = before + encodedEntry.length;
        } catch (IOException e) {
            rollback(before, e);
            throw new BackendUnavailableException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            String next = String.format("%08d.log", Integer.parseInt(
                    current.getFileName().toString().replace(".log", "")) + 1);
            current = dir.resolve(next);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new BackendUnavailableException("WAL rotation failed", e);
        }
    }

    @Override
    public Replay replay() { return new SegmentReplay(segments(dir)); }

    @Override
    public synchronized void close() throws Exception { if (ch != null) ch.close(); }

    private void rollback(long position, IOException cause) {
        try {
            ch.truncate(position);
        } catch (IOException e) {
            cause.addSuppressed(e);
            broken = true;
            log.log(Level.SEVERE, "could not roll back partial WAL record in " + current, e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve("00000001.log") : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validPrefix(ch);
            if (valid < ch.size()) {
                log.warning("truncating " + (ch.size() - valid) + " trailing bytes of torn record in " + current);
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    /** Bytes of {@code ch} covered by complete, checksummed records. */
    private static long validPrefix(FileChannel ch) throws IOException {
        long pos = 0;
        for (byte[] rec; (rec = readRecordAt(ch, pos)) != null; ) {
            pos += EntryCodec.HEADER_BYTES + (long) rec.length;
        }
        return pos;
    }

    /** Payload of the record starting at {@code pos}, or null if it is truncated or corrupt. */
    static byte[] readRecordAt(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(EntryCodec.HEADER_BYTES).order(ByteOrder.BIG_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < EntryCodec.HEADER_BYTES) return null; // truncated header at tail
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != EntryCodec.MAGIC || ver != EntryCodec.VERSION || len < 0) return null;
        if (len > ch.size() - pos - EntryCodec.HEADER_BYTES) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        int r2 = ch.read(payload, pos + EntryCodec.HEADER_BYTES);
        if (r2 < len) return null;
        byte[] bytes = payload.array();
        if (EntryCodec.crc32(bytes) != crc) return null; // bad tail, stop
        return bytes;
    }

    static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    /**
     * Sequential reader over all WAL segments used during recovery.
     */
    private static final class SegmentReplay implements Replay {
        private final List<Path> segments;
        private int segIndex = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean done = false;

        SegmentReplay(List<Path> segments) {
            this.segments = new ArrayList<>(segments);
        }

        @Override
        public byte[] nextPayload() {
            try {
                while (!done) {
                    if (ch == null && !openNextSegment()) {
                        done = true;
                        break;
                    }
                    if (pos >= ch.size()) {
                        // Clean end of this segment, move on.
                        ch.close();
                        ch = null;
                        continue;
                    }
                    byte[] rec = readRecord();
                    if (rec == null) {
                        done = true; // torn or corrupt: nothing after this is trusted
                        break;
                    }
                    return rec;
                }
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segIndex++;
            if (segIndex >= segments.size()) return false;
            ch = FileChannel.open(segments.get(segIndex), READ);
            pos = 0;
            return true;
        }

        private byte[] readRecord() throws IOException {
            byte[] bytes = readRecordAt(ch, pos);
            if (bytes != null) {
                pos += EntryCodec.HEADER_BYTES + (long) bytes.length;
            }
            return bytes;
        }

        @Override
        public void close() throws IOException {
            if (ch != null) ch.close();
        }
    }
}
