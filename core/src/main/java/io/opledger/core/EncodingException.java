package io.opledger.core;

/**
 * Raised when an operation tuple cannot be turned into an unambiguous fingerprint.
 * <p>
 * Typical causes:
 *  - blank operationKind or empty recordId,
 *  - negative nonce,
 *  - a string that has no exact UTF-8 form (unpaired surrogate),
 *  - a field larger than {@link OperationKey#MAX_FIELD_BYTES}.
 * <p>
 * Always thrown before the ledger is touched.
 */
public class EncodingException extends IllegalArgumentException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
