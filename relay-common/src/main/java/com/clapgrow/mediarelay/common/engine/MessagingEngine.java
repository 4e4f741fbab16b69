package com.clapgrow.mediarelay.common.engine;

import java.util.List;
import java.util.Optional;

/**
 * Messaging engine capability.
 * 
 * Abstraction over the component that owns the actual messaging session
 * (a headless browser bridge today). Lifecycle events are not part of this
 * interface; the engine pushes them separately and the worker queues them.
 * 
 * Implementation guidelines:
 * - Throw {@link EngineException} with the engine's original message on failure
 * - Never log media payloads
 * - Send operations return the id of the message created in the target chat,
 *   or {@code null} when the engine does not report it
 */
public interface MessagingEngine {
    
    /**
     * Start the engine and its session. May block until the engine has launched.
     * 
     * @throws EngineException if the engine fails to start
     */
    void initialize();
    
    /**
     * Tear down the engine instance and release its locks.
     * 
     * @throws EngineException if teardown fails
     */
    void destroy();
    
    /**
     * Whether the session is fully connected.
     */
    boolean isReady();
    
    /**
     * Full chat list of the logged-in account.
     * 
     * @return Chats, groups and direct chats alike
     */
    List<ChatSummary> listChats();
    
    /**
     * Download a message's content into memory.
     * 
     * @param messageId Message id
     * @return Payload, or empty when the engine has nothing to download
     */
    Optional<DownloadedMedia> downloadContent(String messageId);
    
    /**
     * Re-send an existing message to another chat with the engine's forward capability.
     * 
     * @param messageId Message to forward
     * @param targetChatId Destination chat
     * @return Id of the forwarded message, may be null
     */
    String forward(String messageId, String targetChatId);
    
    /**
     * Send a fresh media object.
     * 
     * @param targetChatId Destination chat
     * @param media Media object
     * @param options Caption and delivery options
     * @return Id of the sent message, may be null
     */
    String sendMedia(String targetChatId, OutgoingMedia media, SendOptions options);
}
