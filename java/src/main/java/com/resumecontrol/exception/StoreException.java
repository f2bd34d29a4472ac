package com.resumecontrol.exception;

/**
 * Exception thrown when the store fails for a reason the caller cannot fix.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
