package com.clapgrow.mediarelay.worker.exception;

/**
 * Exception thrown when an administrative request is invalid (e.g. a rule whose
 * source is also one of its targets). Mapped to HTTP 400.
 */
public class BadRequestException extends RuntimeException {
    
    public BadRequestException(String message) {
        super(message);
    }
}
