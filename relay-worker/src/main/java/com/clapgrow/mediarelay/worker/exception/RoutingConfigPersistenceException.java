package com.clapgrow.mediarelay.worker.exception;

/**
 * Thrown when the routing config document cannot be written.
 * The in-memory table is left as it was before the failed mutation.
 */
public class RoutingConfigPersistenceException extends RuntimeException {
    
    public RoutingConfigPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
