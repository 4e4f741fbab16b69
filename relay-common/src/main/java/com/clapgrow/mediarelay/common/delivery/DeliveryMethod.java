package com.clapgrow.mediarelay.common.delivery;

/**
 * How a message reached (or failed to reach) a target.
 */
public enum DeliveryMethod {
    /**
     * Payload downloaded and sent as a fresh media object.
     */
    NATIVE_UPLOAD,
    
    /**
     * Original message forwarded with the engine's built-in capability.
     */
    FORWARD,
    
    /**
     * Both stages failed; nothing was delivered.
     */
    NONE
}
