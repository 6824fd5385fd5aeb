package com.metallisense.common.exception;

/**
 * Rejected input: an element is missing, unknown, or outside [0, 100].
 * Raised before any stage runs and surfaced to the caller.
 */
public class InvalidCompositionException extends RuntimeException {

    public InvalidCompositionException(String message) {
        super(message);
    }
}
