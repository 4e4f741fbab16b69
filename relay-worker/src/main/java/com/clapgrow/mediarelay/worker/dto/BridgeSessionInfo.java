package com.clapgrow.mediarelay.worker.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BridgeSessionInfo(boolean connected) {
}
