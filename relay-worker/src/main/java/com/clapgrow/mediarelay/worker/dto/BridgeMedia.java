package com.clapgrow.mediarelay.worker.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Downloaded message content as returned by the bridge; {@code data} is base64.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BridgeMedia(String data, String mimetype, String filename) {
}
