package com.resumecontrol.exception;

/**
 * Exception thrown when caller-supplied data fails validation.
 */
public class InvalidArgumentException extends RuntimeException {

    private final String field;

    public InvalidArgumentException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
