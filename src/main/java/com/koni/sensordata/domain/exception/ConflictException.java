package com.koni.sensordata.domain.exception;

/**
 * Exception thrown when a write violates a uniqueness or integrity constraint,
 * typically because a concurrent writer created the same record first.
 * The transaction has been rolled back; the caller may retry with fresh state.
 */
public class ConflictException extends RuntimeException {
    
    public ConflictException(String message) {
        super(message);
    }
    
    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
