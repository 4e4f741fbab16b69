package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.engine.EngineException;
import com.clapgrow.mediarelay.common.engine.MessagingEngine;
import com.clapgrow.mediarelay.worker.config.RelayProperties;
import com.clapgrow.mediarelay.worker.enums.EngineEventType;
import com.clapgrow.mediarelay.worker.enums.SessionState;
import com.clapgrow.mediarelay.worker.model.EngineEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

    @TempDir
    Path workDir;

    @Mock
    private MessagingEngine engine;

    @Mock
    private EngineEventChannel eventChannel;

    @Mock
    private EventSink eventSink;

    @Mock
    private QrCodeRenderer qrCodeRenderer;

    @Mock
    private GroupDirectoryService groupDirectory;

    @Mock
    private TaskScheduler scheduler;

    private final List<Runnable> scheduledTasks = new ArrayList<>();

    private SessionContext sessionContext;
    private SimpleMeterRegistry meterRegistry;
    private Path authDir;
    private Path cacheDir;
    private SessionLifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        RelayProperties properties = new RelayProperties();
        sessionContext = new SessionContext(new SessionTransitionValidator());
        meterRegistry = new SimpleMeterRegistry();
        RelayMetricsService metricsService = new RelayMetricsService(meterRegistry);
        metricsService.init();

        authDir = workDir.resolve(".wwebjs_auth");
        cacheDir = workDir.resolve(".wwebjs_cache");

        lenient().when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            scheduledTasks.add(invocation.getArgument(0));
            return mock(ScheduledFuture.class);
        });
        lenient().when(qrCodeRenderer.toDataUrl(anyString())).thenReturn("data:image/png;base64,AAAA");

        lifecycle = new SessionLifecycleService(engine, sessionContext, eventChannel, eventSink, qrCodeRenderer,
            groupDirectory, new FailureClassifier(properties), new SessionRetryPolicyResolver(properties),
            new SessionStorageCleaner(List.of(authDir, cacheDir)), metricsService, scheduler, properties);
    }

    @Test
    void testQrDisconnectQrReady_EndsConnectedWithSingleRefreshLoop() {
        // Arrange & Act
        lifecycle.handle(EngineEvent.of(EngineEventType.QR, "2@first"));
        assertEquals(SessionState.AWAITING_SCAN, sessionContext.getState());
        assertNotNull(sessionContext.snapshot().qrDataUrl());

        lifecycle.handle(EngineEvent.of(EngineEventType.DISCONNECTED, "NAVIGATION"));
        assertEquals(SessionState.DISCONNECTED, sessionContext.getState());
        assertTrue(sessionContext.isReconnecting());
        assertNull(sessionContext.snapshot().qrDataUrl());
        runScheduledTasks();

        lifecycle.handle(EngineEvent.of(EngineEventType.QR, "2@second"));
        lifecycle.handle(EngineEvent.of(EngineEventType.AUTHENTICATED));
        lifecycle.handle(EngineEvent.of(EngineEventType.READY));

        // Assert
        assertEquals(SessionState.CONNECTED, sessionContext.getState());
        assertEquals("Connected", sessionContext.getLabel());
        assertFalse(sessionContext.isReconnecting());
        verify(engine).destroy();
        verify(engine).initialize();
        verify(groupDirectory, times(1)).startAutoRefresh();
        verify(eventSink).resetSignal();
        verify(eventSink).readySignal();
        verify(eventSink, times(2)).logLine("Please scan the new QR Code");
    }

    @Test
    void testDuplicateDisconnect_SchedulesSingleReconnect() {
        lifecycle.handle(EngineEvent.of(EngineEventType.READY));

        lifecycle.handle(EngineEvent.of(EngineEventType.DISCONNECTED, "LOGOUT"));
        lifecycle.handle(EngineEvent.of(EngineEventType.DISCONNECTED, "LOGOUT"));

        assertEquals(1, scheduledTasks.size());
        verify(engine, times(1)).destroy();
        verify(groupDirectory, times(2)).cancelAutoRefresh();
    }

    @Test
    void testInitialize_CorruptedSession_WipesStorageBeforeRestart() throws Exception {
        // Arrange
        Files.createDirectories(authDir.resolve("session"));
        Files.writeString(authDir.resolve("session").resolve("Default"), "state");
        doThrow(new EngineException("Protocol error (Runtime.callFunctionOn): Target closed."))
            .doNothing()
            .when(engine).initialize();

        // Act
        lifecycle.initialize();

        // Assert
        assertEquals(SessionState.FATAL_ERROR, sessionContext.getState());
        assertEquals("Init Error", sessionContext.getLabel());
        verify(engine).destroy();
        verify(eventSink).logLine("CRITICAL ERROR: Session corrupted. Performing auto-cleanup...");

        runNextScheduledTask();
        assertFalse(Files.exists(authDir));
        assertFalse(Files.exists(cacheDir));
        verify(engine, times(1)).initialize();
        verify(eventSink).logLine("Session reset. Restarting in 3s...");

        runNextScheduledTask();
        verify(engine, times(2)).initialize();
        assertEquals(SessionState.INITIALIZING, sessionContext.getState());

        InOrder inOrder = inOrder(engine, eventSink);
        inOrder.verify(engine).destroy();
        inOrder.verify(eventSink).logLine("Session reset. Restarting in 3s...");
        inOrder.verify(engine).initialize();
        assertEquals(1.0, meterRegistry.get("relay.session.recoveries")
            .tag("classification", "SESSION_CORRUPTION").counter().count());
    }

    @Test
    void testInitialize_TransientFailure_RetriesWithoutWipe() throws Exception {
        Files.createDirectories(authDir);
        doThrow(new EngineException("Connection refused")).doNothing().when(engine).initialize();

        lifecycle.initialize();

        assertEquals(SessionState.INITIALIZING, sessionContext.getState());
        assertEquals("Init Error", sessionContext.getLabel());
        assertEquals(1, scheduledTasks.size());
        verify(engine, never()).destroy();

        runNextScheduledTask();

        verify(engine, times(2)).initialize();
        assertTrue(Files.exists(authDir));
    }

    @Test
    void testAuthFailure_IsTerminalUntilRestart() {
        lifecycle.handle(EngineEvent.of(EngineEventType.AUTH_FAILURE, "bad credentials"));

        assertEquals(SessionState.AUTH_FAILED, sessionContext.getState());
        assertTrue(scheduledTasks.isEmpty());
        verify(eventSink).logLine("Authentication failed: bad credentials");

        lifecycle.handle(EngineEvent.of(EngineEventType.READY));
        assertEquals(SessionState.AUTH_FAILED, sessionContext.getState());
        verify(groupDirectory, never()).startAutoRefresh();

        lifecycle.restart();
        runScheduledTasks();

        assertEquals(SessionState.INITIALIZING, sessionContext.getState());
        verify(engine).initialize();
    }

    @Test
    void testRestartDuringPendingReconnect_LaterDisconnectStillRecovers() {
        lifecycle.handle(EngineEvent.of(EngineEventType.READY));
        lifecycle.handle(EngineEvent.of(EngineEventType.DISCONNECTED, "NAVIGATION"));
        assertTrue(sessionContext.isReconnecting());

        lifecycle.restart();
        assertFalse(sessionContext.isReconnecting());

        // the reconnect was cancelled by the restart, only the restart task runs
        assertEquals(2, scheduledTasks.size());
        scheduledTasks.remove(0);
        runNextScheduledTask();

        lifecycle.handle(EngineEvent.of(EngineEventType.QR, "2@again"));
        lifecycle.handle(EngineEvent.of(EngineEventType.DISCONNECTED, "NAVIGATION"));

        assertEquals(SessionState.DISCONNECTED, sessionContext.getState());
        assertTrue(sessionContext.isReconnecting());
        assertEquals(1, scheduledTasks.size());

        runNextScheduledTask();
        verify(engine, times(2)).initialize();
        assertFalse(sessionContext.isReconnecting());
    }

    @Test
    void testCorruptionReplacingPendingReconnect_ReleasesReconnectFlag() {
        lifecycle.handle(EngineEvent.of(EngineEventType.READY));
        lifecycle.handle(EngineEvent.of(EngineEventType.DISCONNECTED, "NAVIGATION"));

        lifecycle.handle(EngineEvent.of(EngineEventType.FATAL_ERROR, "Execution context was destroyed"));

        assertEquals(SessionState.FATAL_ERROR, sessionContext.getState());
        assertFalse(sessionContext.isReconnecting());

        lifecycle.handle(EngineEvent.of(EngineEventType.DISCONNECTED, "NAVIGATION"));

        assertEquals(SessionState.DISCONNECTED, sessionContext.getState());
        assertTrue(sessionContext.isReconnecting());
        assertEquals(3, scheduledTasks.size());
    }

    @Test
    void testDisconnectAfterAuthFailure_DoesNotRecover() {
        lifecycle.handle(EngineEvent.of(EngineEventType.AUTH_FAILURE, "bad credentials"));

        lifecycle.handle(EngineEvent.of(EngineEventType.DISCONNECTED, "LOGOUT"));

        assertEquals(SessionState.AUTH_FAILED, sessionContext.getState());
        assertFalse(sessionContext.isReconnecting());
        assertTrue(scheduledTasks.isEmpty());
        verify(engine, never()).destroy();
        verify(engine, never()).initialize();
        verify(eventSink, never()).resetSignal();
    }

    @Test
    void testFatalErrorAfterAuthFailure_DoesNotWipeOrRetry() throws Exception {
        Files.createDirectories(authDir);
        lifecycle.handle(EngineEvent.of(EngineEventType.AUTH_FAILURE, "bad credentials"));

        lifecycle.handle(EngineEvent.of(EngineEventType.FATAL_ERROR, "Protocol error: Target closed"));

        assertEquals(SessionState.AUTH_FAILED, sessionContext.getState());
        assertTrue(scheduledTasks.isEmpty());
        assertTrue(Files.exists(authDir));
        verify(engine, never()).destroy();
    }

    @Test
    void testInitialize_AlreadyConnected_IsSkipped() {
        lifecycle.handle(EngineEvent.of(EngineEventType.READY));

        lifecycle.initialize();

        verify(engine, never()).initialize();
        assertEquals(SessionState.CONNECTED, sessionContext.getState());
    }

    @Test
    void testQrRenderFailure_KeepsState() {
        when(qrCodeRenderer.toDataUrl(anyString())).thenThrow(new IllegalStateException("encoder broke"));

        lifecycle.handle(EngineEvent.of(EngineEventType.QR, "2@payload"));

        assertEquals(SessionState.INITIALIZING, sessionContext.getState());
        verify(eventSink, never()).qrCode(anyString());
    }

    @Test
    void testStart_RegistersConsumerAndSchedulesInitialize() {
        lifecycle.start();

        verify(eventChannel).start(any());
        assertEquals(1, scheduledTasks.size());
        runScheduledTasks();
        verify(engine).initialize();
    }

    private void runNextScheduledTask() {
        assertFalse(scheduledTasks.isEmpty(), "expected a scheduled task");
        scheduledTasks.remove(0).run();
    }

    private void runScheduledTasks() {
        while (!scheduledTasks.isEmpty()) {
            scheduledTasks.remove(0).run();
        }
    }
}
