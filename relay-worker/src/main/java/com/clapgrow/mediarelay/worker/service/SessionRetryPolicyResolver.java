package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.retry.FailureClassification;
import com.clapgrow.mediarelay.common.retry.RetryPolicyResolver;
import com.clapgrow.mediarelay.worker.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Session recovery policy, with delays taken from configuration.
 */
@Service
@RequiredArgsConstructor
public class SessionRetryPolicyResolver implements RetryPolicyResolver {
    
    private final RelayProperties properties;
    
    @Override
    public RetryPolicy resolve(FailureClassification classification) {
        RelayProperties.Session session = properties.getSession();
        return switch (classification) {
            case AUTH_REJECTED -> RetryPolicy.noRetry();
            case SESSION_CORRUPTION -> RetryPolicy.wipeAndRestart(
                session.getCorruptionCleanupDelay().toMillis(),
                session.getCorruptionRestartDelay().toMillis());
            case TRANSIENT -> RetryPolicy.fixedDelay(session.getInitRetryDelay().toMillis());
        };
    }
}
