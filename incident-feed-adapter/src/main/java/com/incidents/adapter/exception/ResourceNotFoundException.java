package com.incidents.adapter.exception;

/**
 * Exception thrown when a requested incident is not stored.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resourceType, String id) {
        super(String.format("%s not found: %s", resourceType, id));
    }
}
