package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.enums.SessionState;
import com.clapgrow.mediarelay.worker.model.GroupRecord;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SseEventSinkTest {

    @Test
    void testSubscribe_RegistersObserver() {
        SessionContext context = new SessionContext(new SessionTransitionValidator());
        context.setQrDataUrl("data:image/png;base64,AAAA");
        context.transition(SessionState.AWAITING_SCAN, null);
        context.replaceGroups(List.of(new GroupRecord("A@g.us", "Family")));
        SseEventSink sink = new SseEventSink(context);

        SseEmitter emitter = sink.subscribe();

        assertNotNull(emitter);
        assertEquals(1, sink.observerCount());
        assertDoesNotThrow(() -> sink.logLine("hello"));
    }

    @Test
    void testSubscribe_ObserverIsRegisteredBeforeSnapshotIsRead() {
        SessionContext context = spy(new SessionContext(new SessionTransitionValidator()));
        SseEventSink sink = new SseEventSink(context);
        AtomicReference<SseEventSink> sinkRef = new AtomicReference<>(sink);
        AtomicInteger observersDuringSnapshot = new AtomicInteger(-1);
        doAnswer(invocation -> {
            observersDuringSnapshot.set(sinkRef.get().observerCount());
            return invocation.callRealMethod();
        }).when(context).snapshot();

        sink.subscribe();

        assertEquals(1, observersDuringSnapshot.get());
        assertEquals(1, sink.observerCount());
    }

    @Test
    void testBroadcast_WithoutObservers_IsNoOp() {
        SseEventSink sink = new SseEventSink(new SessionContext(new SessionTransitionValidator()));

        assertDoesNotThrow(() -> {
            sink.status("Connected");
            sink.readySignal();
            sink.groupsSnapshot(List.of());
        });
        assertEquals(0, sink.observerCount());
    }
}
