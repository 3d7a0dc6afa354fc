package com.shiptrack.common.exception;

/**
 * Exception thrown when a requested resource does not exist
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
