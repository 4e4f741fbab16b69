package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.delivery.DeliveryMethod;
import com.clapgrow.mediarelay.common.retry.FailureClassification;
import com.clapgrow.mediarelay.worker.enums.ClassificationVerdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer counters for the relay.
 * 
 * Tracks:
 * - Deliveries per method and outcome
 * - Inbound messages skipped per verdict
 * - Session recoveries per failure classification
 * 
 * Exposed through actuator. Counters are created once in @PostConstruct.
 */
@Service
@RequiredArgsConstructor
public class RelayMetricsService {
    
    private final MeterRegistry meterRegistry;
    
    private final Map<DeliveryMethod, Counter> deliveredCounters = new EnumMap<>(DeliveryMethod.class);
    private final Map<ClassificationVerdict, Counter> skippedCounters = new EnumMap<>(ClassificationVerdict.class);
    private final Map<FailureClassification, Counter> recoveryCounters = new EnumMap<>(FailureClassification.class);
    private Counter failedDeliveries;
    
    @PostConstruct
    void init() {
        for (DeliveryMethod method : DeliveryMethod.values()) {
            if (method == DeliveryMethod.NONE) {
                continue;
            }
            deliveredCounters.put(method, Counter.builder("relay.deliveries")
                .description("Messages delivered to a target")
                .tag("method", method.name())
                .tag("outcome", "success")
                .register(meterRegistry));
        }
        failedDeliveries = Counter.builder("relay.deliveries")
            .description("Targets that received nothing after both stages failed")
            .tag("method", DeliveryMethod.NONE.name())
            .tag("outcome", "failure")
            .register(meterRegistry);
        
        for (ClassificationVerdict verdict : ClassificationVerdict.values()) {
            if (verdict == ClassificationVerdict.RELAYABLE) {
                continue;
            }
            skippedCounters.put(verdict, Counter.builder("relay.messages.skipped")
                .description("Inbound messages not relayed")
                .tag("reason", verdict.name())
                .register(meterRegistry));
        }
        
        for (FailureClassification classification : FailureClassification.values()) {
            recoveryCounters.put(classification, Counter.builder("relay.session.recoveries")
                .description("Session failures handled by the lifecycle service")
                .tag("classification", classification.name())
                .register(meterRegistry));
        }
    }
    
    public void recordDelivery(DeliveryMethod method, boolean success) {
        if (!success || method == DeliveryMethod.NONE) {
            failedDeliveries.increment();
            return;
        }
        deliveredCounters.get(method).increment();
    }
    
    public void recordSkipped(ClassificationVerdict verdict) {
        Counter counter = skippedCounters.get(verdict);
        if (counter != null) {
            counter.increment();
        }
    }
    
    public void recordRecovery(FailureClassification classification) {
        recoveryCounters.get(classification).increment();
    }
}
