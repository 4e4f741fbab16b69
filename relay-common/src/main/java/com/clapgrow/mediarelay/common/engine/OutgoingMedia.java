package com.clapgrow.mediarelay.common.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Media object handed to {@link MessagingEngine#sendMedia}.
 * 
 * Built from a file on disk. MIME type and filename are inferred from the file
 * and can be overridden, which callers do when they know the original values.
 */
public record OutgoingMedia(
    byte[] data,
    String mimeType,
    String filename
) {
    
    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";
    
    /**
     * Read a media object back from disk, inferring MIME type and filename from the path.
     * 
     * @param path File to read
     * @return Media object with inferred metadata
     * @throws IOException if the file cannot be read
     */
    public static OutgoingMedia fromFile(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        String probed = Files.probeContentType(path);
        return new OutgoingMedia(bytes, probed != null ? probed : DEFAULT_MIME_TYPE,
            path.getFileName().toString());
    }
    
    public OutgoingMedia withMimeType(String mimeType) {
        return new OutgoingMedia(data, mimeType, filename);
    }
    
    public OutgoingMedia withFilename(String filename) {
        return new OutgoingMedia(data, mimeType, filename);
    }
    
    public int size() {
        return data == null ? 0 : data.length;
    }
}
