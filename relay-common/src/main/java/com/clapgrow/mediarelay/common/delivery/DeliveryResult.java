package com.clapgrow.mediarelay.common.delivery;

/**
 * Outcome of delivering one message to one target.
 * 
 * Immutable and independent per target, so one target's failure never
 * leaks into another target's result.
 * 
 * Example usage:
 * <pre>
 * DeliveryResult result = pipeline.deliver(message, targetId);
 * if (!result.success()) {
 *     log.warn("Relay to {} failed: {}", result.targetId(), result.errorMessage());
 * }
 * </pre>
 */
public record DeliveryResult(
    String targetId,
    boolean success,
    DeliveryMethod method,
    String sentMessageId,
    String errorMessage
) {
    
    /**
     * Create a successful result.
     * 
     * @param targetId Target chat
     * @param method Stage that delivered the message
     * @param sentMessageId Id of the message created in the target, may be null
     * @return Success result
     */
    public static DeliveryResult delivered(String targetId, DeliveryMethod method, String sentMessageId) {
        return new DeliveryResult(targetId, true, method, sentMessageId, null);
    }
    
    /**
     * Create a failure result.
     * 
     * @param targetId Target chat
     * @param errorMessage Error of the last stage attempted
     * @return Failure result
     */
    public static DeliveryResult failed(String targetId, String errorMessage) {
        return new DeliveryResult(targetId, false, DeliveryMethod.NONE, null, errorMessage);
    }
}
