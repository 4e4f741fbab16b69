package com.clapgrow.mediarelay.worker.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Media payload written to disk for a native re-upload.
 * Owned by the delivery attempt that created it.
 */
public record TemporaryArtifact(
    Path filePath,
    String mimeType,
    long sizeBytes,
    Instant createdAt
) {
    
    public String filename() {
        return filePath.getFileName().toString();
    }
}
