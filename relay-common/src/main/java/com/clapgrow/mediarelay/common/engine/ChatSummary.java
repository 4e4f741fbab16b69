package com.clapgrow.mediarelay.common.engine;

/**
 * One entry of the engine's chat list.
 */
public record ChatSummary(
    String id,
    boolean group,
    String name
) {
}
