package io.opledger.core;

import java.util.Objects;

/**
 * One accepted write: the fingerprint, who claimed it, the nonce it was
 * submitted with, and its position in the ledger's total order.
 * <p>
 * Created exactly once per fingerprint and never mutated afterwards. The
 * signer is always representable as exact UTF-8, so it survives a round trip
 * through the log unchanged.
 */
public record LedgerEntry(Fingerprint fingerprint, String signer, long nonce, long sequenceNumber) {

    public LedgerEntry {
        Objects.requireNonNull(fingerprint, "fingerprint");
        signerBytes(signer);
        if (sequenceNumber <= 0) {
            throw new IllegalArgumentException("sequenceNumber must be > 0, got: " + sequenceNumber);
        }
    }

    /**
     * Strict UTF-8 form of a signer.
     *
     * @throws IllegalArgumentException if the signer is null or blank
     * @throws EncodingException if it holds unpaired surrogates or exceeds
     *         {@link OperationKey#MAX_FIELD_BYTES}
     */
    public static byte[] signerBytes(String signer) {
        if (signer == null || signer.isBlank()) {
            throw new IllegalArgumentException("signer must not be blank");
        }
        return OperationKey.utf8("signer", signer);
    }
}
