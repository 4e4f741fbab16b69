package com.clapgrow.mediarelay.worker.exception;

/**
 * A delivery stage could not complete; the pipeline moves on to the next stage.
 */
public class DeliveryStageException extends RuntimeException {
    
    public DeliveryStageException(String message) {
        super(message);
    }
    
    public DeliveryStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
