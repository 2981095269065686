package com.fleetmanager.analytics.exception;

/**
 * Thrown when a request names a driver or vehicle that is not registered.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
