package com.clapgrow.mediarelay.worker.enums;

/**
 * State of the messaging session.
 * 
 * Exactly one instance exists per process, owned by SessionContext and
 * mutated only by the session lifecycle service. The default label is what
 * observers see unless the transition supplies a more specific one.
 */
public enum SessionState {
    INITIALIZING("Initializing..."),
    AWAITING_SCAN("Scan QR Code"),
    AUTHENTICATED("Authenticated"),
    CONNECTED("Connected"),
    DISCONNECTED("Disconnected"),
    AUTH_FAILED("Auth Failure"),
    FATAL_ERROR("Init Error");
    
    private final String defaultLabel;
    
    SessionState(String defaultLabel) {
        this.defaultLabel = defaultLabel;
    }
    
    public String getDefaultLabel() {
        return defaultLabel;
    }
}
