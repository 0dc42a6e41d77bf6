package com.uwb.positioning.exception;

/**
 * Exception thrown when a batch could not be persisted. The batch transaction has been rolled
 * back, so none of its rows are visible.
 */
public class IngestionStorageException extends RuntimeException {

    public IngestionStorageException(String message) {
        super(message);
    }

    public IngestionStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
