package com.kats.domain;

/**
 * Thrown when a ledger record or a checkpoint blob cannot be decoded into its typed form.
 */
public class MalformedRecordException extends RuntimeException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
