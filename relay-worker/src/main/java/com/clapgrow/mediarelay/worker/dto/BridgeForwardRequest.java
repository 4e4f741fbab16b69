package com.clapgrow.mediarelay.worker.dto;

public record BridgeForwardRequest(String chatId) {
}
