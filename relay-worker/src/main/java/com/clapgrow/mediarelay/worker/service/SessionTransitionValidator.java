package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.enums.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Validates session state transitions.
 * 
 * Pure enum-map validation: no time, no I/O, no configuration.
 * 
 * Most states may move almost anywhere because the engine can fail or drop
 * the connection at any point. The exceptions:
 * - AUTH_FAILED only leaves through a new QR challenge or an explicit restart
 * - FATAL_ERROR only leaves through re-initialisation (or a late QR / disconnect)
 * 
 * Events that would cause an invalid transition are stale and get ignored.
 */
@Component
@Slf4j
public class SessionTransitionValidator {
    
    private static final Map<SessionState, Set<SessionState>> VALID_TRANSITIONS = Map.of(
        SessionState.INITIALIZING, EnumSet.of(
            SessionState.AWAITING_SCAN,
            SessionState.AUTHENTICATED,
            SessionState.CONNECTED,
            SessionState.DISCONNECTED,
            SessionState.AUTH_FAILED,
            SessionState.FATAL_ERROR
        ),
        SessionState.AWAITING_SCAN, EnumSet.of(
            SessionState.INITIALIZING,
            SessionState.AUTHENTICATED,
            SessionState.CONNECTED,
            SessionState.DISCONNECTED,
            SessionState.AUTH_FAILED,
            SessionState.FATAL_ERROR
        ),
        SessionState.AUTHENTICATED, EnumSet.of(
            SessionState.INITIALIZING,
            SessionState.AWAITING_SCAN,
            SessionState.CONNECTED,
            SessionState.DISCONNECTED,
            SessionState.AUTH_FAILED,
            SessionState.FATAL_ERROR
        ),
        SessionState.CONNECTED, EnumSet.of(
            SessionState.INITIALIZING,
            SessionState.AWAITING_SCAN,
            SessionState.DISCONNECTED,
            SessionState.AUTH_FAILED,
            SessionState.FATAL_ERROR
        ),
        SessionState.DISCONNECTED, EnumSet.of(
            SessionState.INITIALIZING,
            SessionState.AWAITING_SCAN,
            SessionState.AUTHENTICATED,
            SessionState.CONNECTED,
            SessionState.AUTH_FAILED,
            SessionState.FATAL_ERROR
        ),
        SessionState.AUTH_FAILED, EnumSet.of(
            SessionState.INITIALIZING,
            SessionState.AWAITING_SCAN
        ),
        SessionState.FATAL_ERROR, EnumSet.of(
            SessionState.INITIALIZING,
            SessionState.AWAITING_SCAN,
            SessionState.DISCONNECTED
        )
    );
    
    /**
     * Validate if a state transition is allowed.
     * 
     * @param fromState Current state
     * @param toState Desired new state
     * @return true if transition is valid, false otherwise
     */
    public boolean isValidTransition(SessionState fromState, SessionState toState) {
        // Same state is always valid (label may change)
        if (fromState == toState) {
            return true;
        }
        
        Set<SessionState> allowedTransitions = VALID_TRANSITIONS.get(fromState);
        if (allowedTransitions == null || !allowedTransitions.contains(toState)) {
            log.warn("Invalid session transition attempted: {} → {} (not in allowed transitions)", 
                fromState, toState);
            return false;
        }
        
        return true;
    }
}
