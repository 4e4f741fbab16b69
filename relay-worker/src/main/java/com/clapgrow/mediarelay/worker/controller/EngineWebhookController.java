package com.clapgrow.mediarelay.worker.controller;

import com.clapgrow.mediarelay.worker.dto.EngineWebhookRequest;
import com.clapgrow.mediarelay.worker.enums.EngineEventType;
import com.clapgrow.mediarelay.worker.exception.BadRequestException;
import com.clapgrow.mediarelay.worker.model.EngineEvent;
import com.clapgrow.mediarelay.worker.model.InboundMessage;
import com.clapgrow.mediarelay.worker.service.EngineEventChannel;
import com.clapgrow.mediarelay.worker.service.MessageRelayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Receives events pushed by the engine bridge.
 * 
 * Lifecycle events are queued for the session lifecycle service; new messages go
 * straight to the relay. Both are handled asynchronously, the bridge only gets
 * an acknowledgment.
 */
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Engine Webhook", description = "Callbacks from the messaging engine bridge")
public class EngineWebhookController {

    private final EngineEventChannel eventChannel;
    private final MessageRelayService relayService;

    @PostMapping("/webhook")
    @Operation(summary = "Receive an engine event")
    public ResponseEntity<Map<String, Object>> receive(@Valid @RequestBody EngineWebhookRequest request) {
        Optional<EngineEventType> type = EngineEventType.fromWireName(request.getEvent());
        if (type.isEmpty()) {
            log.warn("Ignoring unknown engine event '{}'", request.getEvent());
            return accepted(request.getEvent());
        }

        if (type.get() == EngineEventType.MESSAGE_CREATE) {
            InboundMessage message;
            try {
                message = request.toInboundMessage();
            } catch (IllegalArgumentException e) {
                throw new BadRequestException(e.getMessage());
            }
            relayService.submit(message);
        } else {
            eventChannel.publish(EngineEvent.of(type.get(), request.lifecycleDetail()));
        }
        return accepted(request.getEvent());
    }

    private ResponseEntity<Map<String, Object>> accepted(String event) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", true, "event", event));
    }
}
