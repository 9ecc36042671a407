package com.brokerage.risk.exception;

import lombok.Getter;

/**
 * A malformed transaction record. The record is skipped.
 */
@Getter
public class DataIntegrityException extends RuntimeException {

    private final long transactionId;

    public DataIntegrityException(long transactionId, String message) {
        super(message);
        this.transactionId = transactionId;
    }
}
