package com.clapgrow.mediarelay.common.retry;

/**
 * Classification of messaging-engine failures.
 * 
 * Used to determine the recovery strategy:
 * - SESSION_CORRUPTION: Engine-internal state is unusable; wipe credentials and cache, then cold restart
 * - AUTH_REJECTED: Credentials were rejected; wait for a fresh scan, never retry automatically
 * - TRANSIENT: Retry the same operation after a fixed delay (chat fetch failures, generic init failures)
 * 
 * Shared by every relay worker so that recovery behaves the same regardless
 * of which engine implementation is plugged in.
 */
public enum FailureClassification {
    SESSION_CORRUPTION,  // Wipe session data and restart
    AUTH_REJECTED,       // Stop and wait for a human
    TRANSIENT            // Retry after delay
}
