package com.clapgrow.mediarelay.common.engine;

import java.util.Locale;

/**
 * Declared type of a message as reported by the messaging engine.
 * 
 * Wire names follow the engine's own vocabulary ("chat" for plain text,
 * "ptt" for voice notes). Unknown wire names map to {@link #OTHER} instead
 * of failing, since the engine adds new types without notice.
 */
public enum MediaKind {
    TEXT("chat"),
    IMAGE("image"),
    VIDEO("video"),
    GIF("gif"),
    AUDIO("audio"),
    VOICE("ptt"),
    DOCUMENT("document"),
    STICKER("sticker"),
    OTHER("other");
    
    private final String wireName;
    
    MediaKind(String wireName) {
        this.wireName = wireName;
    }
    
    public String getWireName() {
        return wireName;
    }
    
    /**
     * Kinds relayed without looking at the MIME type.
     */
    public boolean isVisualMedia() {
        return this == IMAGE || this == VIDEO || this == GIF;
    }
    
    /**
     * Kinds delivered with voice-note semantics.
     */
    public boolean isAudio() {
        return this == AUDIO || this == VOICE;
    }
    
    /**
     * Parse a kind from the engine wire name or the enum name (case-insensitive).
     * 
     * @param name Wire name such as "image" or "ptt"
     * @return Matching kind, {@link #OTHER} when unknown, {@link #TEXT} when blank
     */
    public static MediaKind fromWireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return TEXT;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MediaKind kind : values()) {
            if (kind.wireName.equals(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }
}
