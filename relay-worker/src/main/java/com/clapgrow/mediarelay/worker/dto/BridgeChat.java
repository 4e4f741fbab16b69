package com.clapgrow.mediarelay.worker.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BridgeChat(
    String id,
    @JsonProperty("isGroup") boolean isGroup,
    String name
) {
}
