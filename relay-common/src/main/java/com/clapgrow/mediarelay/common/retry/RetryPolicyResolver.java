package com.clapgrow.mediarelay.common.retry;

/**
 * Resolves the recovery policy for a failure classification.
 * 
 * Maps failure classifications to recovery strategies:
 * - SESSION_CORRUPTION: Wipe persisted session data, then restart after a cleanup and a restart delay
 * - AUTH_REJECTED: No retry
 * - TRANSIENT: Retry after a fixed delay
 * 
 * Keeps the decision of what went wrong separate from what to do about it.
 */
public interface RetryPolicyResolver {
    
    /**
     * Resolve the recovery policy for a given failure classification.
     * 
     * @param classification Failure classification
     * @return Recovery policy
     */
    RetryPolicy resolve(FailureClassification classification);
    
    /**
     * Recovery policy configuration.
     * 
     * {@code cleanupDelayMs} only applies when {@code wipeSession} is set; the
     * restart is scheduled {@code retryDelayMs} after the cleanup has run.
     */
    record RetryPolicy(
        boolean shouldRetry,
        boolean wipeSession,
        long cleanupDelayMs,
        long retryDelayMs
    ) {
        /**
         * No retry policy (for rejected credentials).
         */
        public static RetryPolicy noRetry() {
            return new RetryPolicy(false, false, 0, 0);
        }
        
        /**
         * Plain retry after a fixed delay (for transient failures).
         */
        public static RetryPolicy fixedDelay(long retryDelayMs) {
            return new RetryPolicy(true, false, 0, retryDelayMs);
        }
        
        /**
         * Wipe the session, then restart (for corrupted sessions).
         */
        public static RetryPolicy wipeAndRestart(long cleanupDelayMs, long restartDelayMs) {
            return new RetryPolicy(true, true, cleanupDelayMs, restartDelayMs);
        }
    }
}
