package com.clapgrow.mediarelay.worker.engine;

import com.clapgrow.mediarelay.common.engine.ChatSummary;
import com.clapgrow.mediarelay.common.engine.DownloadedMedia;
import com.clapgrow.mediarelay.common.engine.EngineException;
import com.clapgrow.mediarelay.common.engine.MessagingEngine;
import com.clapgrow.mediarelay.common.engine.OutgoingMedia;
import com.clapgrow.mediarelay.common.engine.SendOptions;
import com.clapgrow.mediarelay.worker.config.RelayProperties;
import com.clapgrow.mediarelay.worker.dto.BridgeChat;
import com.clapgrow.mediarelay.worker.dto.BridgeForwardRequest;
import com.clapgrow.mediarelay.worker.dto.BridgeMedia;
import com.clapgrow.mediarelay.worker.dto.BridgeMediaRequest;
import com.clapgrow.mediarelay.worker.dto.BridgeSendResponse;
import com.clapgrow.mediarelay.worker.dto.BridgeSessionInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * {@link MessagingEngine} backed by the HTTP bridge that drives the WhatsApp Web client.
 * 
 * Session lifecycle events and new messages come back from the bridge through the
 * webhook; this class only issues commands. Every failure surfaces as an
 * {@link EngineException} carrying the bridge's {@code error} message when it sent one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BridgeMessagingEngine implements MessagingEngine {
    
    private static final ParameterizedTypeReference<List<BridgeChat>> CHAT_LIST =
        new ParameterizedTypeReference<>() { };
    
    private final WebClient engineWebClient;
    private final ObjectMapper objectMapper;
    private final RelayProperties properties;
    
    @Override
    public void initialize() {
        log.info("Starting bridge session");
        call("start session", () -> engineWebClient.post()
            .uri("/session/start")
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout())
            .block());
    }
    
    @Override
    public void destroy() {
        log.info("Destroying bridge session");
        call("destroy session", () -> engineWebClient.post()
            .uri("/session/destroy")
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout())
            .block());
    }
    
    @Override
    public boolean isReady() {
        BridgeSessionInfo info = call("read session info", () -> engineWebClient.get()
            .uri("/session/info")
            .retrieve()
            .bodyToMono(BridgeSessionInfo.class)
            .timeout(timeout())
            .block());
        return info != null && info.connected();
    }
    
    @Override
    public List<ChatSummary> listChats() {
        List<BridgeChat> chats = call("list chats", () -> engineWebClient.get()
            .uri("/chats")
            .retrieve()
            .bodyToMono(CHAT_LIST)
            .timeout(timeout())
            .block());
        if (chats == null) {
            return List.of();
        }
        return chats.stream()
            .map(chat -> new ChatSummary(chat.id(), chat.isGroup(), chat.name()))
            .toList();
    }
    
    @Override
    public Optional<DownloadedMedia> downloadContent(String messageId) {
        BridgeMedia media;
        try {
            media = engineWebClient.get()
                .uri("/messages/{id}/media", messageId)
                .retrieve()
                .bodyToMono(BridgeMedia.class)
                .timeout(timeout())
                .block();
        } catch (WebClientResponseException.NotFound e) {
            log.debug("No content available for message {}", messageId);
            return Optional.empty();
        } catch (Exception e) {
            throw translate("download message content", e);
        }
        
        if (media == null || media.data() == null || media.data().isEmpty()) {
            return Optional.empty();
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(media.data());
        } catch (IllegalArgumentException e) {
            throw new EngineException("Bridge returned malformed media data for " + messageId, e);
        }
        return Optional.of(new DownloadedMedia(data, media.mimetype(), media.filename()));
    }
    
    @Override
    public String forward(String messageId, String targetChatId) {
        BridgeSendResponse response = call("forward message", () -> engineWebClient.post()
            .uri("/messages/{id}/forward", messageId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new BridgeForwardRequest(targetChatId))
            .retrieve()
            .bodyToMono(BridgeSendResponse.class)
            .timeout(timeout())
            .block());
        return response != null ? response.id() : null;
    }
    
    @Override
    public String sendMedia(String targetChatId, OutgoingMedia media, SendOptions options) {
        BridgeMediaRequest request = new BridgeMediaRequest(
            Base64.getEncoder().encodeToString(media.data()),
            media.mimeType(),
            media.filename(),
            options.caption(),
            options.sendAudioAsVoice(),
            options.sendMediaAsDocument());
        
        BridgeSendResponse response = call("send media", () -> engineWebClient.post()
            .uri("/chats/{id}/media", targetChatId)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(BridgeSendResponse.class)
            .timeout(timeout())
            .block());
        return response != null ? response.id() : null;
    }
    
    private Duration timeout() {
        return properties.getEngine().getRequestTimeout();
    }
    
    private <T> T call(String operation, BridgeCall<T> request) {
        try {
            return request.execute();
        } catch (Exception e) {
            throw translate(operation, e);
        }
    }
    
    private EngineException translate(String operation, Exception e) {
        if (e instanceof EngineException engineException) {
            return engineException;
        }
        if (e instanceof WebClientResponseException responseException) {
            String message = errorMessage(responseException);
            log.error("Bridge failed to {}: HTTP {} {}", operation,
                responseException.getStatusCode().value(), message);
            return new EngineException(message, e);
        }
        log.error("Bridge call to {} failed: {}", operation, e.getMessage());
        return new EngineException(
            e.getMessage() != null ? e.getMessage() : "Bridge call to " + operation + " failed", e);
    }
    
    /**
     * The bridge reports failures as {@code {"error": "..."}}; fall back to the HTTP status.
     */
    private String errorMessage(WebClientResponseException e) {
        String body = e.getResponseBodyAsString();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node != null && node.hasNonNull("error")) {
                    return node.get("error").asText();
                }
            } catch (Exception parseError) {
                log.debug("Bridge error body is not JSON: {}", body);
            }
        }
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        return "Bridge responded " + e.getStatusCode().value()
            + (status != null ? " " + status.getReasonPhrase() : "");
    }
    
    @FunctionalInterface
    private interface BridgeCall<T> {
        T execute();
    }
}
