package com.koni.sensordata.domain.exception;

/**
 * Exception thrown when required input for a store operation is missing.
 */
public class ValidationException extends RuntimeException {
    
    public ValidationException(String message) {
        super(message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
