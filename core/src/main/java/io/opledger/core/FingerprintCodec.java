// file: src/main/java/io/opledger/core/FingerprintCodec.java
package io.opledger.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic, injective encoding of an operation tuple into a {@link Fingerprint}.
 * <p>
 * Pre-image layout (big-endian):
 * <p>
 *   - domain tag:    "opledger.fp.v1" (ASCII, fixed)
 *   - operationKind: int32 len + UTF-8 bytes
 *   - recordId:      int32 len + UTF-8 bytes
 *   - nonce:         int64
 * <p>
 * The pre-image is hashed with SHA-256.
 * <p>
 * Length prefixes make the pre-image uniquely decodable: ("A","BC",1) and
 * ("AB","C",1) produce different byte strings, unlike plain concatenation
 * where both would read "ABC1".
 */
public final class FingerprintCodec {
    static final byte[] DOMAIN_TAG = "opledger.fp.v1".getBytes(StandardCharsets.US_ASCII);

    private FingerprintCodec() {
        // utility
    }

    public static Fingerprint encode(String operationKind, String recordId, long nonce) {
        return encode(new OperationKey(operationKind, recordId, nonce));
    }

    public static Fingerprint encode(OperationKey key) {
        return new Fingerprint(sha256(preImage(key)));
    }

    /** Byte string that gets hashed. Package-private for tests. */
    static byte[] preImage(OperationKey key) {
        byte[] kind = OperationKey.utf8("operationKind", key.operationKind());
        byte[] record = OperationKey.utf8("recordId", key.recordId());

        int size = DOMAIN_TAG.length;
        size += 4 + kind.length;    // operationKind
        size += 4 + record.length;  // recordId
        size += 8;                  // nonce

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
        b.put(DOMAIN_TAG);
        b.putInt(kind.length).put(kind);
        b.putInt(record.length).put(record);
        b.putLong(key.nonce());
        return b.array();
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
