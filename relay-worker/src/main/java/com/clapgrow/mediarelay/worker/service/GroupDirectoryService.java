package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.engine.ChatSummary;
import com.clapgrow.mediarelay.common.engine.MessagingEngine;
import com.clapgrow.mediarelay.worker.config.RelayProperties;
import com.clapgrow.mediarelay.worker.enums.SessionState;
import com.clapgrow.mediarelay.worker.exception.DirectoryRefreshException;
import com.clapgrow.mediarelay.worker.model.GroupRecord;
import com.clapgrow.mediarelay.worker.model.RefreshResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the group directory (group id → display name) in sync with the engine.
 * 
 * After the session connects, an automatic loop polls the chat list:
 * - groups found: publish them, re-check until the confirm budget is spent
 * - no groups yet: retry every interval until the attempt budget is spent,
 *   then ask for a manual refresh
 * - fetch failure: logged and counted against the attempt budget
 * 
 * At most one loop runs at a time; starting a new loop cancels the previous one.
 * Each refresh replaces the whole directory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GroupDirectoryService {
    
    private final MessagingEngine engine;
    private final SessionContext sessionContext;
    private final EventSink eventSink;
    private final TaskScheduler relayTaskScheduler;
    private final RelayProperties properties;
    
    private final AtomicReference<RefreshLoop> currentLoop = new AtomicReference<>();
    private final AtomicInteger activeLoops = new AtomicInteger();
    
    /**
     * Start the automatic refresh loop, replacing any loop still running.
     */
    public void startAutoRefresh() {
        RefreshLoop loop = new RefreshLoop();
        RefreshLoop previous = currentLoop.getAndSet(loop);
        if (previous != null) {
            log.info("Replacing running group refresh loop");
            previous.cancel();
        }
        loop.scheduleNext(Duration.ZERO);
    }
    
    /**
     * Stop the automatic loop, e.g. because the session dropped.
     */
    public void cancelAutoRefresh() {
        RefreshLoop previous = currentLoop.getAndSet(null);
        if (previous != null) {
            previous.cancel();
            log.info("Group refresh loop cancelled");
        }
    }
    
    public int activeLoopCount() {
        return activeLoops.get();
    }
    
    /**
     * Single unconditional fetch-and-publish, only while connected.
     * 
     * @return Group count, or "not ready" when the session is not connected
     * @throws DirectoryRefreshException if the chat list cannot be fetched
     */
    public RefreshResult refreshNow() {
        if (sessionContext.getState() != SessionState.CONNECTED) {
            log.info("Manual group refresh requested while {}", sessionContext.getState());
            return RefreshResult.notReady();
        }
        if (!engineReady()) {
            log.info("Manual group refresh requested before the engine reported a session");
            return RefreshResult.notReady();
        }
        
        log.info("Manual group refresh requested");
        List<GroupRecord> groups;
        try {
            groups = toGroups(engine.listChats());
        } catch (RuntimeException e) {
            throw new DirectoryRefreshException(
                e.getMessage() != null ? e.getMessage() : "Failed to fetch chats", e);
        }
        publish(groups);
        return RefreshResult.refreshed(groups.size());
    }
    
    private boolean engineReady() {
        try {
            return engine.isReady();
        } catch (RuntimeException e) {
            log.warn("Could not read engine session info: {}", e.getMessage());
            return false;
        }
    }
    
    public List<GroupRecord> currentGroups() {
        return sessionContext.getGroups();
    }
    
    private void publish(List<GroupRecord> groups) {
        sessionContext.replaceGroups(groups);
        eventSink.groupsSnapshot(groups);
    }
    
    private static List<GroupRecord> toGroups(List<ChatSummary> chats) {
        if (chats == null) {
            return List.of();
        }
        return chats.stream()
            .filter(ChatSummary::group)
            .map(chat -> new GroupRecord(chat.id(), chat.name()))
            .toList();
    }
    
    private final class RefreshLoop {
        
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicBoolean finished = new AtomicBoolean();
        private volatile ScheduledFuture<?> pending;
        
        RefreshLoop() {
            activeLoops.incrementAndGet();
        }
        
        void scheduleNext(Duration delay) {
            if (finished.get()) {
                return;
            }
            pending = relayTaskScheduler.schedule(this::attempt, Instant.now().plus(delay));
        }
        
        void cancel() {
            if (finish()) {
                ScheduledFuture<?> task = pending;
                if (task != null) {
                    task.cancel(false);
                }
            }
        }
        
        private boolean finish() {
            if (finished.compareAndSet(false, true)) {
                activeLoops.decrementAndGet();
                currentLoop.compareAndSet(this, null);
                return true;
            }
            return false;
        }
        
        private void attempt() {
            if (finished.get()) {
                return;
            }
            if (sessionContext.getState() != SessionState.CONNECTED) {
                log.info("Session is {}, stopping group refresh loop", sessionContext.getState());
                finish();
                return;
            }
            
            RelayProperties.Directory settings = properties.getDirectory();
            int attempt = attempts.incrementAndGet();
            try {
                log.info("Fetching chats (Attempt {})...", attempt);
                List<ChatSummary> chats = engine.listChats();
                List<GroupRecord> groups = toGroups(chats);
                if (finished.get()) {
                    return;
                }
                
                if (!groups.isEmpty()) {
                    publish(groups);
                    eventSink.logLine("Success: Loaded " + groups.size() + " groups.");
                    if (attempt < settings.getMaxConfirmAttempts()) {
                        scheduleNext(settings.getRetryInterval());
                    } else {
                        finish();
                    }
                } else {
                    int scanned = chats == null ? 0 : chats.size();
                    eventSink.logLine("Syncing... Scanned " + scanned + " chats so far (Waiting for groups)");
                    retryOrGiveUp(attempt, settings);
                }
            } catch (Exception e) {
                log.error("Error fetching chats (Attempt {})", attempt, e);
                eventSink.logLine("Error reading chats. Retrying...");
                retryOrGiveUp(attempt, settings);
            }
        }
        
        private void retryOrGiveUp(int attempt, RelayProperties.Directory settings) {
            if (attempt < settings.getMaxAttempts()) {
                scheduleNext(settings.getRetryInterval());
            } else {
                log.warn("No groups found after {} attempts, waiting for manual refresh", attempt);
                eventSink.logLine("Could not find groups automatically. Please click \"Refresh Groups\" manually.");
                finish();
            }
        }
    }
}
