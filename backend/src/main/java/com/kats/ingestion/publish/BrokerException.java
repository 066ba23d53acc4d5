package com.kats.ingestion.publish;

/**
 * Thrown when a JetStream call (publish, stream management, message lookup) fails.
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
