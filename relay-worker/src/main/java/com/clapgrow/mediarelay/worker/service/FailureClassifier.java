package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.retry.FailureClassification;
import com.clapgrow.mediarelay.worker.config.RelayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Classifies engine failures to determine the recovery strategy.
 * 
 * Classification rules:
 * - SESSION_CORRUPTION: Message of the error (or any cause) contains a configured
 *   corruption signature ("Execution context was destroyed", "Protocol error",
 *   "Evaluation failed")
 * - TRANSIENT: Everything else
 * 
 * AUTH_REJECTED never comes out of an exception; it is reported by the engine
 * as an auth-failure event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FailureClassifier {
    
    private final RelayProperties properties;
    
    /**
     * Classify an initialisation or engine failure.
     * 
     * @param error Failure (may be null)
     * @return Failure classification
     */
    public FailureClassification classify(Throwable error) {
        String messages = collectMessages(error).toLowerCase(Locale.ROOT);
        
        for (String signature : properties.getSession().getCorruptionSignatures()) {
            if (signature != null && !signature.isBlank()
                    && messages.contains(signature.toLowerCase(Locale.ROOT))) {
                log.debug("Matched corruption signature '{}'", signature);
                return FailureClassification.SESSION_CORRUPTION;
            }
        }
        
        return FailureClassification.TRANSIENT;
    }
    
    private String collectMessages(Throwable error) {
        StringBuilder messages = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current.getMessage() != null) {
                messages.append(current.getMessage()).append('\n');
            }
            current = current.getCause();
            depth++;
        }
        return messages.toString();
    }
}
