package com.clapgrow.mediarelay.worker.model;

import com.clapgrow.mediarelay.common.engine.MediaKind;

/**
 * Message observed by the engine. Lives only for the duration of one relay attempt.
 * 
 * @param id Engine message id
 * @param chatId Chat the message was posted in
 * @param chatName Display name of that chat, may be null
 * @param group Whether the chat is a group
 * @param declaredType Type declared by the engine
 * @param mimeType MIME type of attached content, may be null
 * @param body Text body or caption, may be null
 * @param hasDownloadableContent Whether the engine can download a payload for it
 */
public record InboundMessage(
    String id,
    String chatId,
    String chatName,
    boolean group,
    MediaKind declaredType,
    String mimeType,
    String body,
    boolean hasDownloadableContent
) {
    
    public InboundMessage {
        declaredType = declaredType == null ? MediaKind.TEXT : declaredType;
    }
    
    /**
     * Name used in progress narration.
     */
    public String displayChatName() {
        return chatName != null && !chatName.isBlank() ? chatName : chatId;
    }
}
