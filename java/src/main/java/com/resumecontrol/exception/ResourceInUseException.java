package com.resumecontrol.exception;

/**
 * Exception thrown when the store refuses to delete a row that other rows still reference.
 */
public class ResourceInUseException extends ConflictException {

    private final Long resourceId;

    public ResourceInUseException(String resource, Long resourceId, Throwable cause) {
        super(String.format("%s with identifier '%s' is still referenced and cannot be deleted",
                resource, resourceId), cause);
        this.resourceId = resourceId;
    }

    @Override
    public Long getConflictingId() {
        return resourceId;
    }
}
