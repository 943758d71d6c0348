package io.opledger.core;

/**
 * The durability backend behind the ledger could not complete a read or write.
 * <p>
 * This is an infrastructure failure, not a duplicate: the fingerprint involved
 * has NOT been claimed and the caller may retry later.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
