package com.clapgrow.mediarelay.worker.dto;

/**
 * Media upload sent to the bridge; {@code data} is base64.
 */
public record BridgeMediaRequest(
    String data,
    String mimetype,
    String filename,
    String caption,
    boolean sendAudioAsVoice,
    boolean sendMediaAsDocument
) {
}
