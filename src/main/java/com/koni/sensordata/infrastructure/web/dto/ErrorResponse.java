package com.koni.sensordata.infrastructure.web.dto;

import lombok.Getter;

import java.time.Instant;

/**
 * Error body returned by every REST endpoint: HTTP status, a client-facing message,
 * the request path that failed and when it happened.
 */
@Getter
public class ErrorResponse {
    
    private final int status;
    private final String message;
    private final String path;
    private final Instant timestamp = Instant.now();
    
    public ErrorResponse(int status, String message, String path) {
        this.status = status;
        this.message = message;
        this.path = path;
    }
}
