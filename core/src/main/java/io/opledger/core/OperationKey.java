// file: src/main/java/io/opledger/core/OperationKey.java
package io.opledger.core;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Identity of one logical operation: (operationKind, recordId, nonce).
 * <p>
 * Validation happens here, at the boundary, so that malformed input never
 * reaches the hash function:
 *  - operationKind: non-blank, e.g. "Create", "Update", "Delete" (any value allowed).
 *  - recordId:      opaque, non-empty.
 *  - nonce:         >= 0, usually a timestamp but any caller-chosen axis is fine.
 * <p>
 * Both strings must have an exact UTF-8 form and fit in {@link #MAX_FIELD_BYTES}.
 */
public record OperationKey(String operationKind, String recordId, long nonce) {

    /** Upper bound for the UTF-8 size of a single string field. */
    public static final int MAX_FIELD_BYTES = 64 * 1024;

    public OperationKey {
        if (operationKind == null || operationKind.isBlank()) {
            throw new EncodingException("operationKind must not be blank");
        }
        if (recordId == null || recordId.isEmpty()) {
            throw new EncodingException("recordId must not be empty");
        }
        if (nonce < 0) {
            throw new EncodingException("nonce must be >= 0, got: " + nonce);
        }
        // Fail early on strings the codec could not represent.
        utf8("operationKind", operationKind);
        utf8("recordId", recordId);
    }

    public static OperationKey of(String operationKind, String recordId, long nonce) {
        return new OperationKey(operationKind, recordId, nonce);
    }

    /**
     * Strict UTF-8 encoding. The JDK's String.getBytes() silently replaces
     * unmappable input with '?', which would let two different strings share
     * a fingerprint, so we report instead.
     */
    static byte[] utf8(String field, String s) {
        CharsetEncoder enc = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer buf = enc.encode(CharBuffer.wrap(s));
            if (buf.remaining() > MAX_FIELD_BYTES) {
                throw new EncodingException(field + " exceeds " + MAX_FIELD_BYTES + " bytes");
            }
            byte[] out = new byte[buf.remaining()];
            buf.get(out);
            return out;
        } catch (CharacterCodingException e) {
            throw new EncodingException(field + " is not valid UTF-16 text", e);
        }
    }

    @Override
    public String toString() {
        return operationKind + ":" + recordId + ":" + nonce;
    }
}
