package com.clapgrow.mediarelay.worker.dto;

import com.clapgrow.mediarelay.common.engine.MediaKind;
import com.clapgrow.mediarelay.worker.model.InboundMessage;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Event pushed by the engine bridge: {@code {"event": "...", "data": ...}}.
 * 
 * Lifecycle events carry either a plain string or an object with one of
 * {@code qr}, {@code reason}, {@code message} or {@code error}.
 */
@Data
public class EngineWebhookRequest {
    @NotBlank(message = "Event name is required")
    private String event;

    private JsonNode data;

    public String lifecycleDetail() {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return null;
        }
        if (data.isValueNode()) {
            return data.asText();
        }
        for (String field : new String[] {"qr", "reason", "message", "error"}) {
            if (data.hasNonNull(field)) {
                return data.get(field).asText();
            }
        }
        return data.toString();
    }

    /**
     * Message carried by a {@code message_create} event.
     * 
     * @throws IllegalArgumentException if the message id or chat id is missing
     */
    public InboundMessage toInboundMessage() {
        if (data == null || !data.isObject()) {
            throw new IllegalArgumentException("message_create event without message data");
        }
        String id = text("id");
        String chatId = text("chatId");
        if (id == null || chatId == null) {
            throw new IllegalArgumentException("message_create event requires id and chatId");
        }
        return new InboundMessage(
            id,
            chatId,
            text("chatName"),
            data.path("isGroup").asBoolean(false),
            MediaKind.fromWireName(text("type")),
            text("mimetype"),
            text("body"),
            data.path("hasMedia").asBoolean(false));
    }

    private String text(String field) {
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
