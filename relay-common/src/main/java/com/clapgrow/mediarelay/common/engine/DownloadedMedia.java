package com.clapgrow.mediarelay.common.engine;

/**
 * Payload of a message's downloadable content, held in memory.
 * 
 * @param data Raw bytes (never base64)
 * @param mimeType MIME type reported by the engine, may be null
 * @param filename Original filename if the engine knows it, may be null
 */
public record DownloadedMedia(
    byte[] data,
    String mimeType,
    String filename
) {
    
    public boolean isEmpty() {
        return data == null || data.length == 0;
    }
    
    public int size() {
        return data == null ? 0 : data.length;
    }
}
