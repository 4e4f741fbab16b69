package com.clapgrow.mediarelay.worker.model;

/**
 * Group chat known to the directory.
 */
public record GroupRecord(String id, String name) {
}
