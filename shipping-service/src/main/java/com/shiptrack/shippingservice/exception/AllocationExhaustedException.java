package com.shiptrack.shippingservice.exception;

/**
 * Exception thrown when no free tracking number was found within the configured number of attempts
 * HTTP Status: 500 Internal Server Error
 */
public class AllocationExhaustedException extends RuntimeException {

    public AllocationExhaustedException(String message) {
        super(message);
    }
}
