package com.clapgrow.mediarelay.worker.enums;

/**
 * Result of classifying an inbound message.
 */
public enum ClassificationVerdict {
    /**
     * Message is not from a group chat.
     */
    NOT_GROUP,
    
    /**
     * Group is not a source of any routing rule.
     */
    NO_MATCHING_RULE,
    
    /**
     * Message was produced by the relay itself.
     */
    RELAY_ECHO,
    
    /**
     * Source matches but the message is not relayable media.
     */
    NOT_MEDIA,
    
    /**
     * Media matches rules but every matching rule filters its kind out.
     */
    FILTERED_BY_TYPE,
    
    /**
     * Relay to the targets of the matched rules.
     */
    RELAYABLE
}
