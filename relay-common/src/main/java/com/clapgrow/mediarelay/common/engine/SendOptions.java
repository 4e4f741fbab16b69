package com.clapgrow.mediarelay.common.engine;

/**
 * Options for sending a media object.
 * 
 * @param caption Caption shown under the media, empty string when none
 * @param sendAudioAsVoice Deliver audio as a voice note
 * @param sendMediaAsDocument Deliver as a generic attachment instead of inline media
 */
public record SendOptions(
    String caption,
    boolean sendAudioAsVoice,
    boolean sendMediaAsDocument
) {
    
    public static SendOptions inline(String caption, boolean sendAudioAsVoice) {
        return new SendOptions(caption == null ? "" : caption, sendAudioAsVoice, false);
    }
}
