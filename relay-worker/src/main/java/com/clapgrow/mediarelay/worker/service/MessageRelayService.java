package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.delivery.DeliveryResult;
import com.clapgrow.mediarelay.common.engine.MediaKind;
import com.clapgrow.mediarelay.worker.config.RelayProperties;
import com.clapgrow.mediarelay.worker.enums.ClassificationVerdict;
import com.clapgrow.mediarelay.worker.model.Classification;
import com.clapgrow.mediarelay.worker.model.InboundMessage;
import com.clapgrow.mediarelay.worker.model.RoutingRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Relays media posted in source groups to the targets of the matching rules.
 * 
 * Flow per inbound message:
 * 1. Drop messages from non-group chats and messages the relay sent itself
 * 2. Classify against the current routing table snapshot
 * 3. Deliver to every distinct target of the accepting rules, never back to the source
 * 
 * Each target is isolated: a failed target never prevents delivery to the others.
 */
@Service
@Slf4j
public class MessageRelayService {
    
    private final MessageClassifier classifier;
    private final RoutingTableService routingTable;
    private final DeliveryPipeline deliveryPipeline;
    private final RelayLoopGuard loopGuard;
    private final EventSink eventSink;
    private final RelayMetricsService metricsService;
    private final RelayProperties properties;
    private final ThreadPoolTaskExecutor relayExecutor;
    private final ThreadPoolTaskExecutor deliveryExecutor;
    
    public MessageRelayService(MessageClassifier classifier,
                               RoutingTableService routingTable,
                               DeliveryPipeline deliveryPipeline,
                               RelayLoopGuard loopGuard,
                               EventSink eventSink,
                               RelayMetricsService metricsService,
                               RelayProperties properties,
                               @Qualifier("relayExecutor") ThreadPoolTaskExecutor relayExecutor,
                               @Qualifier("deliveryExecutor") ThreadPoolTaskExecutor deliveryExecutor) {
        this.classifier = classifier;
        this.routingTable = routingTable;
        this.deliveryPipeline = deliveryPipeline;
        this.loopGuard = loopGuard;
        this.eventSink = eventSink;
        this.metricsService = metricsService;
        this.properties = properties;
        this.relayExecutor = relayExecutor;
        this.deliveryExecutor = deliveryExecutor;
    }
    
    /**
     * Hand an inbound message to the relay executor and return immediately.
     */
    public void submit(InboundMessage message) {
        try {
            relayExecutor.execute(() -> {
                try {
                    relay(message);
                } catch (Exception e) {
                    log.error("Failed to relay message {}", message.id(), e);
                }
            });
        } catch (TaskRejectedException e) {
            log.error("Relay executor rejected message {}, dropping it", message.id(), e);
        }
    }
    
    /**
     * Classify one message and deliver it to all its targets.
     * 
     * @return One result per target attempted; empty when nothing was relayed
     */
    public List<DeliveryResult> relay(InboundMessage message) {
        if (!message.group()) {
            metricsService.recordSkipped(ClassificationVerdict.NOT_GROUP);
            return List.of();
        }
        
        String typeName = message.declaredType().getWireName();
        eventSink.logLine("DEBUG: Saw " + typeName + " in " + message.displayChatName());
        
        if (loopGuard.isRelayEcho(message.id())) {
            log.info("Ignoring {} in {}, it was sent by the relay", message.id(), message.chatId());
            metricsService.recordSkipped(ClassificationVerdict.RELAY_ECHO);
            return List.of();
        }
        
        Classification classification = classifier.classify(message, routingTable.snapshot());
        switch (classification.verdict()) {
            case RELAYABLE -> {
                eventSink.logLine("Detected " + typeName.toUpperCase(Locale.ROOT) + " ("
                    + (message.mimeType() == null ? "" : message.mimeType()) + ") in " + message.displayChatName());
                return fanOut(message, targetsOf(classification.rules(), message.chatId()));
            }
            case NOT_MEDIA -> {
                log.debug("Skipping type: {} (Mime: {})", typeName, message.mimeType());
                if (message.declaredType() != MediaKind.TEXT) {
                    eventSink.logLine("Skipped " + typeName + " (Not an image/video)");
                }
            }
            case FILTERED_BY_TYPE -> log.debug("No rule for {} accepts type {}", message.chatId(), typeName);
            default -> log.debug("Not relaying {}: {}", message.id(), classification.verdict());
        }
        metricsService.recordSkipped(classification.verdict());
        return List.of();
    }
    
    /**
     * Distinct targets in rule order, without the source chat itself.
     */
    static List<String> targetsOf(List<RoutingRule> rules, String sourceId) {
        Set<String> targets = new LinkedHashSet<>();
        for (RoutingRule rule : rules) {
            for (String target : rule.targets()) {
                if (!target.equals(sourceId)) {
                    targets.add(target);
                }
            }
        }
        return new ArrayList<>(targets);
    }
    
    private List<DeliveryResult> fanOut(InboundMessage message, List<String> targets) {
        if (!properties.getDelivery().isParallelFanOut() || targets.size() < 2) {
            List<DeliveryResult> results = new ArrayList<>();
            for (String target : targets) {
                results.add(deliverTo(message, target));
            }
            return results;
        }
        
        List<CompletableFuture<DeliveryResult>> futures = new ArrayList<>();
        for (String target : targets) {
            futures.add(submitDelivery(message, target));
        }
        return futures.stream()
            .map(CompletableFuture::join)
            .toList();
    }
    
    private CompletableFuture<DeliveryResult> submitDelivery(InboundMessage message, String target) {
        try {
            return CompletableFuture.supplyAsync(() -> deliverTo(message, target), deliveryExecutor);
        } catch (TaskRejectedException e) {
            log.warn("Delivery executor saturated, delivering {} to {} inline", message.id(), target);
            return CompletableFuture.completedFuture(deliverTo(message, target));
        }
    }
    
    private DeliveryResult deliverTo(InboundMessage message, String target) {
        try {
            eventSink.logLine("--> Processing " + message.declaredType().getWireName() + " for target...");
            DeliveryResult result = deliveryPipeline.deliver(message, target);
            if (result.success()) {
                loopGuard.remember(result.sentMessageId());
            }
            return result;
        } catch (Exception e) {
            log.error("Unexpected failure delivering {} to {}", message.id(), target, e);
            return DeliveryResult.failed(target, e.getMessage());
        }
    }
}
