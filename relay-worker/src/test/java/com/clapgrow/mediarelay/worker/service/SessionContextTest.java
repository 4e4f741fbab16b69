package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.enums.SessionState;
import com.clapgrow.mediarelay.worker.model.GroupRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionContextTest {

    private final SessionContext context = new SessionContext(new SessionTransitionValidator());

    @Test
    void testInitialState() {
        SessionContext.Snapshot snapshot = context.snapshot();

        assertEquals(SessionState.INITIALIZING, snapshot.state());
        assertEquals("Initializing...", snapshot.label());
        assertNull(snapshot.qrDataUrl());
        assertTrue(snapshot.groups().isEmpty());
        assertFalse(snapshot.reconnecting());
    }

    @Test
    void testTransition_LeavingAwaitingScanClearsQr() {
        context.setQrDataUrl("data:image/png;base64,AAAA");
        context.transition(SessionState.AWAITING_SCAN, null);
        assertEquals("data:image/png;base64,AAAA", context.snapshot().qrDataUrl());
        assertEquals("Scan QR Code", context.getLabel());

        context.transition(SessionState.CONNECTED, "Connected");

        assertNull(context.snapshot().qrDataUrl());
    }

    @Test
    void testTransition_RejectedKeepsState() {
        context.transition(SessionState.AUTH_FAILED, "Auth Failure");

        assertFalse(context.transition(SessionState.CONNECTED, "Connected"));
        assertEquals(SessionState.AUTH_FAILED, context.getState());
        assertTrue(context.transition(SessionState.INITIALIZING, "Initializing..."));
    }

    @Test
    void testBeginReconnect_OnlyOneOwner() {
        assertTrue(context.beginReconnect());
        assertFalse(context.beginReconnect());

        context.endReconnect();

        assertTrue(context.beginReconnect());
    }

    @Test
    void testReplaceGroups_IsDefensiveCopy() {
        List<GroupRecord> groups = new ArrayList<>(List.of(new GroupRecord("A@g.us", "Family")));

        context.replaceGroups(groups);
        groups.clear();

        assertEquals(1, context.getGroups().size());
        context.replaceGroups(null);
        assertTrue(context.getGroups().isEmpty());
    }
}
