package com.kats.ingestion.adapter;

/**
 * Thrown when a ledger call fails (transport, HTTP status or an {@code ok:false} API response).
 * {@code retryable} marks transport failures, throttling and 5xx responses.
 */
public class LedgerException extends RuntimeException {

    private final boolean retryable;

    public LedgerException(String message) {
        this(message, false, null);
    }

    public LedgerException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public LedgerException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
