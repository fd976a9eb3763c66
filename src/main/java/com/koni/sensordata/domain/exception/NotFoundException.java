package com.koni.sensordata.domain.exception;

/**
 * Exception thrown when a lookup by identifier finds no matching record.
 * Callers treat this as a normal negative result (e.g. HTTP 404).
 */
public class NotFoundException extends RuntimeException {
    
    public NotFoundException(String message) {
        super(message);
    }
    
    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
