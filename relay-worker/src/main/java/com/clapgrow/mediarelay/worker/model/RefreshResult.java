package com.clapgrow.mediarelay.worker.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of an on-demand directory refresh.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefreshResult(
    boolean success,
    Integer count,
    String message
) {
    
    public static RefreshResult refreshed(int count) {
        return new RefreshResult(true, count, null);
    }
    
    public static RefreshResult notReady() {
        return new RefreshResult(false, null, "Client not ready");
    }
}
