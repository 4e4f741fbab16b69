package com.clapgrow.mediarelay.worker.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Maps MIME types to file extensions for temporary media files.
 */
@Component
public class MediaExtensionResolver {
    
    static final String DEFAULT_MIME_TYPE = "application/octet-stream";
    
    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
        Map.entry("image/jpeg", "jpg"),
        Map.entry("image/png", "png"),
        Map.entry("image/webp", "webp"),
        Map.entry("image/gif", "gif"),
        Map.entry("video/mp4", "mp4"),
        Map.entry("video/3gpp", "3gp"),
        Map.entry("video/quicktime", "mov"),
        Map.entry("video/x-matroska", "mkv"),
        Map.entry("audio/ogg", "ogg"),
        Map.entry("audio/mpeg", "mp3"),
        Map.entry("audio/mp4", "m4a")
    );
    
    /**
     * Extension without the dot. Unknown types fall back to their subtype, or "bin".
     */
    public String extensionFor(String mimeType) {
        String normalized = normalize(mimeType);
        String known = EXTENSIONS.get(normalized);
        if (known != null) {
            return known;
        }
        int slash = normalized.indexOf('/');
        if (slash < 0 || slash == normalized.length() - 1) {
            return "bin";
        }
        String sanitized = normalized.substring(slash + 1).replaceAll("[^a-z0-9.-]", "");
        return sanitized.isEmpty() ? "bin" : sanitized;
    }
    
    /**
     * Lower-cased MIME type without parameters; octet-stream when absent.
     */
    public String normalize(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return DEFAULT_MIME_TYPE;
        }
        String value = mimeType;
        int semicolon = value.indexOf(';');
        if (semicolon >= 0) {
            value = value.substring(0, semicolon);
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        return value.isEmpty() ? DEFAULT_MIME_TYPE : value;
    }
}
