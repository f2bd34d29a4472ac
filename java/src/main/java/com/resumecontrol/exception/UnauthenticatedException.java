package com.resumecontrol.exception;

/**
 * Exception thrown when no valid owner identity is present in the call context.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }
}
