package io.opledger.server;

/**
 * Raised when a caller's wait limit elapses before the coalesced write finished.
 * The write itself keeps running; the caller simply does not learn its outcome.
 */
public class CoalescerTimeoutException extends RuntimeException {
    public CoalescerTimeoutException(String message) {
        super(message);
    }
}
