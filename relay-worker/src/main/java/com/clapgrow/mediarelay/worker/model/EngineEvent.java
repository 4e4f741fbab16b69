package com.clapgrow.mediarelay.worker.model;

import com.clapgrow.mediarelay.worker.enums.EngineEventType;

import java.time.Instant;

/**
 * Lifecycle event from the engine.
 * 
 * @param type Event type
 * @param detail QR payload for QR events, reason or error text otherwise; may be null
 * @param receivedAt Arrival time at the worker
 */
public record EngineEvent(EngineEventType type, String detail, Instant receivedAt) {
    
    public static EngineEvent of(EngineEventType type, String detail) {
        return new EngineEvent(type, detail, Instant.now());
    }
    
    public static EngineEvent of(EngineEventType type) {
        return of(type, null);
    }
}
