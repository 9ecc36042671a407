package com.brokerage.risk.exception;

/**
 * The store was temporarily unreachable. The operation may be retried later
 * without loss; the feed marker is never advanced past a failed read.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
