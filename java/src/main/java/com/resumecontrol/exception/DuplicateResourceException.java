package com.resumecontrol.exception;

/**
 * Exception thrown when attempting to create or rename a resource onto a key
 * that another resource of the same owner already holds.
 */
public class DuplicateResourceException extends ConflictException {

    private final Long conflictingId;

    public DuplicateResourceException(String message) {
        super(message);
        this.conflictingId = null;
    }

    public DuplicateResourceException(String resource, String identifier, Long conflictingId) {
        super(String.format("%s with identifier '%s' already exists", resource, identifier));
        this.conflictingId = conflictingId;
    }

    @Override
    public Long getConflictingId() {
        return conflictingId;
    }
}
