package com.kats.ingestion.checkpoint;

/**
 * Thrown when the checkpoint store cannot be read or written. Fatal to the current sync run.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
