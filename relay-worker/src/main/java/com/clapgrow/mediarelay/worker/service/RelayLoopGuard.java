package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers ids of messages the relay sent itself, so that seeing them again in
 * a group that is also a source does not relay them a second time.
 * 
 * Entries expire after the configured TTL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelayLoopGuard {
    
    private final RelayProperties properties;
    
    private final Map<String, Instant> sentIds = new ConcurrentHashMap<>();
    
    public void remember(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return;
        }
        sentIds.put(messageId, Instant.now().plus(properties.getDelivery().getLoopGuardTtl()));
        if (sentIds.size() % 100 == 0) {
            purgeExpired();
        }
    }
    
    /**
     * Whether the id belongs to a message the relay sent within the TTL.
     */
    public boolean isRelayEcho(String messageId) {
        if (messageId == null) {
            return false;
        }
        Instant expiry = sentIds.get(messageId);
        if (expiry == null) {
            return false;
        }
        if (expiry.isBefore(Instant.now())) {
            sentIds.remove(messageId, expiry);
            return false;
        }
        return true;
    }
    
    public void purgeExpired() {
        Instant now = Instant.now();
        int before = sentIds.size();
        sentIds.entrySet().removeIf(entry -> entry.getValue().isBefore(now));
        int removed = before - sentIds.size();
        if (removed > 0) {
            log.debug("Purged {} expired relay ids", removed);
        }
    }
    
    public int size() {
        return sentIds.size();
    }
}
