package com.resumecontrol.exception;

/**
 * Exception thrown when a requested resource is not found.
 *
 * Also used when the row exists but belongs to another owner; callers cannot
 * tell the two cases apart.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;

    public ResourceNotFoundException(String resource, Object identifier) {
        super(String.format("%s with identifier '%s' not found", resource, identifier));
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
