package com.resumecontrol.exception;

/**
 * Base type for operations blocked by a uniqueness or referential-integrity rule.
 */
public abstract class ConflictException extends RuntimeException {

    protected ConflictException(String message) {
        super(message);
    }

    protected ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Id of the row the operation collided with, if known.
     */
    public Long getConflictingId() {
        return null;
    }
}
