package com.clapgrow.mediarelay.worker.exception;

/**
 * Thrown when an on-demand group directory refresh cannot fetch the chat list.
 */
public class DirectoryRefreshException extends RuntimeException {
    
    public DirectoryRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
