package com.fleetmanager.analytics.exception;

/**
 * Thrown when a requested period has its start after its end.
 * Raised before any record is read; the caller must correct the window and retry.
 */
public class InvalidWindowException extends RuntimeException {

    public InvalidWindowException(String message) {
        super(message);
    }
}
