package com.clapgrow.mediarelay.worker.exception;

/**
 * Thrown when a rule is deleted by a position outside the routing table.
 */
public class InvalidRuleIndexException extends RuntimeException {
    
    private final int index;
    
    public InvalidRuleIndexException(int index) {
        super("Invalid index");
        this.index = index;
    }
    
    public int getIndex() {
        return index;
    }
}
