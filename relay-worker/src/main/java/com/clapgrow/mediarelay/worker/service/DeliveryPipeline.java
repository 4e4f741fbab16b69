package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.delivery.DeliveryMethod;
import com.clapgrow.mediarelay.common.delivery.DeliveryResult;
import com.clapgrow.mediarelay.common.engine.DownloadedMedia;
import com.clapgrow.mediarelay.common.engine.MessagingEngine;
import com.clapgrow.mediarelay.common.engine.OutgoingMedia;
import com.clapgrow.mediarelay.common.engine.SendOptions;
import com.clapgrow.mediarelay.worker.exception.DeliveryStageException;
import com.clapgrow.mediarelay.worker.model.InboundMessage;
import com.clapgrow.mediarelay.worker.model.TemporaryArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Delivers one message to one target.
 * 
 * Stage 1 (native re-upload) downloads the payload, writes it to a temporary
 * file and sends it as new media with the original caption. Stage 2 (forward)
 * runs when stage 1 is skipped or fails. A target counts as failed only when
 * both stages fail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryPipeline {
    
    private final MessagingEngine engine;
    private final TemporaryArtifactStore artifactStore;
    private final EventSink eventSink;
    private final RelayMetricsService metricsService;
    
    /**
     * Deliver a message to a single target. Never throws.
     */
    public DeliveryResult deliver(InboundMessage message, String targetId) {
        if (message.hasDownloadableContent()) {
            try {
                String sentId = sendNative(message, targetId);
                eventSink.logLine("--> Sent as Native Media");
                metricsService.recordDelivery(DeliveryMethod.NATIVE_UPLOAD, true);
                return DeliveryResult.delivered(targetId, DeliveryMethod.NATIVE_UPLOAD, sentId);
            } catch (Exception e) {
                log.warn("Native send of {} to {} failed", message.id(), targetId, e);
                eventSink.logLine("Native Send failed: " + e.getMessage() + ". Trying forward...");
            }
        }
        
        try {
            eventSink.logLine("Switching to Fallback Forward...");
            String sentId = engine.forward(message.id(), targetId);
            eventSink.logLine("--> Forwarded (Fallback)");
            metricsService.recordDelivery(DeliveryMethod.FORWARD, true);
            return DeliveryResult.delivered(targetId, DeliveryMethod.FORWARD, sentId);
        } catch (Exception e) {
            log.error("Failed to deliver {} to {}", message.id(), targetId, e);
            eventSink.logLine("!! Error sending " + message.declaredType().getWireName() + ": " + e.getMessage());
            metricsService.recordDelivery(DeliveryMethod.NONE, false);
            return DeliveryResult.failed(targetId, e.getMessage());
        }
    }
    
    private String sendNative(InboundMessage message, String targetId) throws Exception {
        eventSink.logLine("Downloading media content...");
        Optional<DownloadedMedia> downloaded = engine.downloadContent(message.id());
        if (downloaded.isEmpty() || downloaded.get().isEmpty()) {
            eventSink.logLine("Download failed (Data unavailable).");
            throw new DeliveryStageException("Download returned no data");
        }
        DownloadedMedia media = downloaded.get();
        
        TemporaryArtifact artifact = artifactStore.write(media.data(), media.mimeType());
        try {
            if (artifact.sizeBytes() == 0) {
                throw new DeliveryStageException("File empty after write");
            }
            
            // The observed MIME type and our filename win over whatever the file re-read infers.
            OutgoingMedia outgoing = OutgoingMedia.fromFile(artifact.filePath())
                .withMimeType(artifact.mimeType())
                .withFilename(artifact.filename());
            SendOptions options = SendOptions.inline(message.body(), message.declaredType().isAudio());
            
            eventSink.logLine(String.format(Locale.ROOT, "Media cached locally (%.2f MB). Sending...",
                artifact.sizeBytes() / 1024.0 / 1024.0));
            return engine.sendMedia(targetId, outgoing, options);
        } finally {
            artifactStore.scheduleCleanup(artifact);
        }
    }
}
