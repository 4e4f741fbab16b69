package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.model.GroupRecord;

import java.util.List;

/**
 * Fire-and-forget channel to observers (dashboard, logs).
 * 
 * No acknowledgment and no history: an observer that connects late only sees
 * the current snapshot.
 */
public interface EventSink {
    
    void status(String label);
    
    void qrCode(String imageDataUrl);
    
    void readySignal();
    
    /**
     * Observers drop any cached "ready" state (sent on disconnect).
     */
    void resetSignal();
    
    void logLine(String text);
    
    void groupsSnapshot(List<GroupRecord> groups);
}
