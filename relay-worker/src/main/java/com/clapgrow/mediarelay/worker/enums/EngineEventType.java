package com.clapgrow.mediarelay.worker.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle and message events pushed by the engine bridge.
 */
public enum EngineEventType {
    QR("qr"),
    AUTHENTICATED("authenticated"),
    READY("ready"),
    AUTH_FAILURE("auth_failure"),
    DISCONNECTED("disconnected"),
    FATAL_ERROR("fatal_error"),
    MESSAGE_CREATE("message_create");
    
    private final String wireName;
    
    EngineEventType(String wireName) {
        this.wireName = wireName;
    }
    
    public String getWireName() {
        return wireName;
    }
    
    public boolean isLifecycleEvent() {
        return this != MESSAGE_CREATE;
    }
    
    public static Optional<EngineEventType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EngineEventType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
