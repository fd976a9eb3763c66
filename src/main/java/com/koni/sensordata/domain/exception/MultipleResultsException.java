package com.koni.sensordata.domain.exception;

/**
 * Exception thrown when more than one record matches a key that is expected to be unique.
 * This indicates an internal consistency fault in the store and is never expected in normal operation.
 */
public class MultipleResultsException extends RuntimeException {
    
    public MultipleResultsException(String message) {
        super(message);
    }
    
    public MultipleResultsException(String message, Throwable cause) {
        super(message, cause);
    }
}
