package com.uwb.positioning.exception;

/**
 * Thrown when a batch carries no usable input at all. Distinct from a processed batch that
 * happened to save nothing.
 */
public class EmptyBatchException extends RuntimeException {

    public EmptyBatchException(String message) {
        super(message);
    }
}
