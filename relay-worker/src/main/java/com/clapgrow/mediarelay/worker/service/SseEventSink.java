package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.model.GroupRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link EventSink} backed by server-sent events.
 * 
 * Event names: status, qr, ready, reset, log, groups. Every log line is also
 * written to the application log. Emitters that fail on send are dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SseEventSink implements EventSink {
    
    private static final long NO_TIMEOUT = 0L;
    
    private final SessionContext sessionContext;
    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    
    /**
     * Register a new observer and send it the current snapshot.
     */
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(NO_TIMEOUT);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(error -> emitters.remove(emitter));
        emitters.add(emitter);
        
        SessionContext.Snapshot snapshot = sessionContext.snapshot();
        try {
            emitter.send(SseEmitter.event().name("status").data(snapshot.label()));
            if (snapshot.qrDataUrl() != null) {
                emitter.send(SseEmitter.event().name("qr").data(snapshot.qrDataUrl()));
            }
            emitter.send(SseEmitter.event().name("groups").data(snapshot.groups()));
            if (!snapshot.groups().isEmpty()) {
                emitter.send(SseEmitter.event().name("log")
                    .data("Syncing " + snapshot.groups().size() + " groups..."));
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Observer went away before receiving the snapshot: {}", e.getMessage());
            emitters.remove(emitter);
            emitter.completeWithError(e);
            return emitter;
        }
        
        log.debug("Observer subscribed ({} active)", emitters.size());
        return emitter;
    }
    
    public int observerCount() {
        return emitters.size();
    }
    
    @Override
    public void status(String label) {
        broadcast("status", label);
    }
    
    @Override
    public void qrCode(String imageDataUrl) {
        broadcast("qr", imageDataUrl);
    }
    
    @Override
    public void readySignal() {
        broadcast("ready", "");
    }
    
    @Override
    public void resetSignal() {
        broadcast("reset", "");
    }
    
    @Override
    public void logLine(String text) {
        log.info("[relay] {}", text);
        broadcast("log", text);
    }
    
    @Override
    public void groupsSnapshot(List<GroupRecord> groups) {
        broadcast("groups", groups);
    }
    
    private void broadcast(String eventName, Object data) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(data));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping observer after failed '{}' send: {}", eventName, e.getMessage());
                emitters.remove(emitter);
            }
        }
    }
}
