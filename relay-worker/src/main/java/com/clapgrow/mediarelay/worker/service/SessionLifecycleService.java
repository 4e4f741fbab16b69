package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.engine.EngineException;
import com.clapgrow.mediarelay.common.engine.MessagingEngine;
import com.clapgrow.mediarelay.common.retry.FailureClassification;
import com.clapgrow.mediarelay.common.retry.RetryPolicyResolver;
import com.clapgrow.mediarelay.common.retry.RetryPolicyResolver.RetryPolicy;
import com.clapgrow.mediarelay.worker.config.RelayProperties;
import com.clapgrow.mediarelay.worker.enums.SessionState;
import com.clapgrow.mediarelay.worker.model.EngineEvent;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the engine session: start, QR pairing, ready, disconnect and recovery.
 * 
 * Engine lifecycle events arrive through {@link EngineEventChannel} and are
 * handled one at a time on its consumer thread. Timed recovery work runs on the
 * relay scheduler; at most one recovery is pending at any time, and scheduling
 * a new one cancels the previous.
 * 
 * Recovery rules:
 * - disconnect: tear down, re-initialise after the reconnect delay (one reconnect at a time)
 * - auth failure: terminal until an operator restarts the session
 * - init failure: retry after the init delay
 * - session corruption: tear down, wipe stored session data, then re-initialise
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLifecycleService {
    
    static final String INIT_ERROR_LABEL = "Init Error";
    
    private final MessagingEngine engine;
    private final SessionContext sessionContext;
    private final EngineEventChannel eventChannel;
    private final EventSink eventSink;
    private final QrCodeRenderer qrCodeRenderer;
    private final GroupDirectoryService groupDirectory;
    private final FailureClassifier failureClassifier;
    private final RetryPolicyResolver retryPolicyResolver;
    private final SessionStorageCleaner storageCleaner;
    private final RelayMetricsService metricsService;
    private final TaskScheduler relayTaskScheduler;
    private final RelayProperties properties;
    
    private final ReentrantLock initLock = new ReentrantLock();
    private final AtomicReference<ScheduledFuture<?>> pendingRecovery = new AtomicReference<>();
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getSession().isAutoStart()) {
            log.info("Session auto-start disabled");
            return;
        }
        start();
    }
    
    /**
     * Start consuming engine events and kick off the first initialisation.
     */
    public void start() {
        eventChannel.start(this::handle);
        scheduleRecovery("initial start", Duration.ZERO, this::initialize);
    }
    
    /**
     * Operator-triggered restart, e.g. after an auth failure.
     */
    public void restart() {
        log.info("Session restart requested");
        eventSink.logLine("Restarting session...");
        groupDirectory.cancelAutoRefresh();
        sessionContext.transition(SessionState.INITIALIZING, SessionState.INITIALIZING.getDefaultLabel());
        eventSink.status(sessionContext.getLabel());
        scheduleRecovery("operator restart", Duration.ZERO, () -> {
            destroyQuietly();
            initialize();
        });
    }
    
    /**
     * Ask the engine to (re)start the session.
     * 
     * A call while another initialisation is in flight, or once the session is
     * already connected, is a no-op.
     */
    public void initialize() {
        if (!initLock.tryLock()) {
            log.info("Initialisation already in progress, skipping");
            return;
        }
        try {
            if (sessionContext.getState() == SessionState.CONNECTED) {
                log.info("Session already connected, skipping stale initialisation");
                return;
            }
            moveTo(SessionState.INITIALIZING, SessionState.INITIALIZING.getDefaultLabel());
            log.info("Initialising messaging engine");
            eventSink.logLine("Launching messaging engine... (Please wait)");
            engine.initialize();
        } catch (Exception e) {
            handleInitFailure(e);
        } finally {
            initLock.unlock();
        }
    }
    
    /**
     * Dispatch one engine lifecycle event.
     */
    public void handle(EngineEvent event) {
        log.debug("Handling engine event {}", event.type());
        switch (event.type()) {
            case QR -> onQr(event.detail());
            case AUTHENTICATED -> onAuthenticated();
            case READY -> onReady();
            case AUTH_FAILURE -> onAuthFailure(event.detail());
            case DISCONNECTED -> onDisconnected(event.detail());
            case FATAL_ERROR -> handleInitFailure(new EngineException(
                event.detail() != null ? event.detail() : "Engine reported a fatal error"));
            case MESSAGE_CREATE -> log.warn("Message events are not lifecycle events, ignoring");
        }
    }
    
    void onQr(String payload) {
        String dataUrl;
        try {
            dataUrl = qrCodeRenderer.toDataUrl(payload);
        } catch (RuntimeException e) {
            log.error("Failed to render QR code", e);
            eventSink.logLine("Failed to render QR code: " + e.getMessage());
            return;
        }
        sessionContext.setQrDataUrl(dataUrl);
        eventSink.qrCode(dataUrl);
        moveTo(SessionState.AWAITING_SCAN, SessionState.AWAITING_SCAN.getDefaultLabel());
        eventSink.logLine("Please scan the new QR Code");
    }
    
    void onAuthenticated() {
        moveTo(SessionState.AUTHENTICATED, SessionState.AUTHENTICATED.getDefaultLabel());
        eventSink.logLine("Authentication successful, waiting for ready...");
    }
    
    void onReady() {
        if (!moveTo(SessionState.CONNECTED, SessionState.CONNECTED.getDefaultLabel())) {
            return;
        }
        cancelPendingRecovery();
        eventSink.readySignal();
        eventSink.logLine("Fetching groups... (This can take 30s for new logins)");
        groupDirectory.startAutoRefresh();
    }
    
    void onAuthFailure(String message) {
        moveTo(SessionState.AUTH_FAILED, SessionState.AUTH_FAILED.getDefaultLabel());
        groupDirectory.cancelAutoRefresh();
        cancelPendingRecovery();
        eventSink.logLine("Authentication failed: " + message);
        metricsService.recordRecovery(FailureClassification.AUTH_REJECTED);
        log.warn("Authentication rejected, waiting for operator restart");
    }
    
    void onDisconnected(String reason) {
        if (!moveTo(SessionState.DISCONNECTED, SessionState.DISCONNECTED.getDefaultLabel())) {
            log.info("Ignoring disconnect ({}) in state {}", reason, sessionContext.getState());
            return;
        }
        eventSink.resetSignal();
        groupDirectory.cancelAutoRefresh();
        eventSink.logLine("Disconnected (" + reason + "). Reconnecting...");
        
        if (!sessionContext.beginReconnect()) {
            log.info("Reconnect already in progress, ignoring duplicate disconnect");
            return;
        }
        metricsService.recordRecovery(FailureClassification.TRANSIENT);
        destroyQuietly();
        scheduleReconnect(properties.getSession().getReconnectDelay());
    }
    
    private void handleInitFailure(Exception error) {
        FailureClassification classification = failureClassifier.classify(error);
        RetryPolicy policy = retryPolicyResolver.resolve(classification);
        metricsService.recordRecovery(classification);
        log.error("Engine initialisation failed ({})", classification, error);
        
        if (sessionContext.getState() == SessionState.AUTH_FAILED) {
            log.warn("Session is waiting for an operator restart, not recovering");
            return;
        }
        if (!policy.shouldRetry()) {
            return;
        }
        
        if (policy.wipeSession()) {
            moveTo(SessionState.FATAL_ERROR, SessionState.FATAL_ERROR.getDefaultLabel());
            groupDirectory.cancelAutoRefresh();
            eventSink.logLine("CRITICAL ERROR: Session corrupted. Performing auto-cleanup...");
            destroyQuietly();
            scheduleRecovery("session cleanup", Duration.ofMillis(policy.cleanupDelayMs()),
                () -> wipeAndRestart(policy));
            return;
        }
        
        sessionContext.transition(SessionState.INITIALIZING, INIT_ERROR_LABEL);
        eventSink.status(sessionContext.getLabel());
        eventSink.logLine("Initialization failed. Retrying in "
            + Duration.ofMillis(policy.retryDelayMs()).toSeconds() + "s...");
        scheduleRecovery("init retry", Duration.ofMillis(policy.retryDelayMs()), this::initialize);
    }
    
    private void wipeAndRestart(RetryPolicy policy) {
        try {
            storageCleaner.wipe();
            eventSink.logLine("Session reset. Restarting in "
                + Duration.ofMillis(policy.retryDelayMs()).toSeconds() + "s...");
        } catch (IOException e) {
            log.error("Failed to wipe session storage", e);
            eventSink.logLine("Auto-cleanup failed. Please delete the session folders manually.");
        }
        scheduleRecovery("restart after cleanup", Duration.ofMillis(policy.retryDelayMs()), this::initialize);
    }
    
    private boolean moveTo(SessionState next, String label) {
        if (!sessionContext.transition(next, label)) {
            log.warn("Rejected session transition {} -> {}", sessionContext.getState(), next);
            return false;
        }
        eventSink.status(sessionContext.getLabel());
        return true;
    }
    
    private void destroyQuietly() {
        try {
            engine.destroy();
        } catch (Exception e) {
            log.warn("Engine teardown failed: {}", e.getMessage());
        }
    }
    
    /**
     * Replace any pending recovery with the given task. A reconnect that is
     * still pending gets cancelled here, so the reconnect flag is released too.
     */
    private void scheduleRecovery(String reason, Duration delay, Runnable task) {
        replacePendingRecovery(reason, delay, task);
        sessionContext.endReconnect();
    }
    
    /**
     * Schedule the reconnect that owns the reconnect flag. The flag is released
     * when the task runs or when another recovery replaces it.
     */
    private void scheduleReconnect(Duration delay) {
        replacePendingRecovery("reconnect", delay, () -> {
            sessionContext.endReconnect();
            initialize();
        });
    }
    
    private void replacePendingRecovery(String reason, Duration delay, Runnable task) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Recovery task '{}' failed", reason, e);
            }
        };
        ScheduledFuture<?> next = relayTaskScheduler.schedule(guarded, Instant.now().plus(delay));
        ScheduledFuture<?> previous = pendingRecovery.getAndSet(next);
        if (previous != null && !previous.isDone()) {
            log.debug("Cancelling pending recovery in favour of '{}'", reason);
            previous.cancel(false);
        }
        log.info("Scheduled {} in {} ms", reason, delay.toMillis());
    }
    
    private void cancelPendingRecovery() {
        ScheduledFuture<?> previous = pendingRecovery.getAndSet(null);
        if (previous != null && !previous.isDone()) {
            previous.cancel(false);
        }
        sessionContext.endReconnect();
    }
    
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down session lifecycle");
        cancelPendingRecovery();
        groupDirectory.cancelAutoRefresh();
        eventChannel.stop();
        destroyQuietly();
    }
}
