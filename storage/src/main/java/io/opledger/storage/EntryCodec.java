// file: src/main/java/io/opledger/storage/EntryCodec.java
package io.opledger.storage;

import io.opledger.core.Fingerprint;
import io.opledger.core.LedgerEntry;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for ledger WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, big-endian)]
 *     - magic   (2B)  = 0x0FE1   (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, big-endian)]
 *     - fingerprint: 32 bytes
 *     - signer:      int32 len + UTF-8 bytes
 *     - nonce:       int64
 *     - sequence:    int64
 */
final class EntryCodec {
    static final short MAGIC = (short) 0x0FE1;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    private EntryCodec() {
    }

    /** Encode a ledger entry into header+payload bytes ready for append. */
    static byte[] encode(LedgerEntry entry) {
        byte[] payload = encodePayload(entry);
        ByteBuffer out = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.BIG_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        out.put(payload);
        return out.array();
    }

    /** Decode a full payload (not including header). */
    static LedgerEntry decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.BIG_ENDIAN);
        byte[] fp = new byte[Fingerprint.LENGTH];
        b.get(fp);
        int signerLen = b.getInt();
        if (signerLen < 0 || signerLen > b.remaining()) {
            throw new IllegalStateException("corrupt signer length: " + signerLen);
        }
        byte[] signer = new byte[signerLen];
        b.get(signer);
        long nonce = b.getLong();
        long seq = b.getLong();
        return new LedgerEntry(new Fingerprint(fp), new String(signer, StandardCharsets.UTF_8), nonce, seq);
    }

    private static byte[] encodePayload(LedgerEntry e) {
        byte[] signer = LedgerEntry.signerBytes(e.signer());

        int size = 0;
        size += Fingerprint.LENGTH;   // fingerprint
        size += 4 + signer.length;    // signer
        size += 8;                    // nonce
        size += 8;                    // sequence

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
        b.put(e.fingerprint().bytes());
        b.putInt(signer.length).put(signer);
        b.putLong(e.nonce());
        b.putLong(e.sequenceNumber());
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
