package com.clapgrow.mediarelay.common.engine;

/**
 * Thrown when a messaging-engine operation fails.
 * 
 * The message carries the engine's own error text unchanged, since recovery
 * decisions (for example session corruption) are made by matching on it.
 */
public class EngineException extends RuntimeException {
    
    public EngineException(String message) {
        super(message);
    }
    
    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
