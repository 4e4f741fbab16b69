package com.clapgrow.mediarelay.common.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OutgoingMediaTest {
    
    @TempDir
    Path tempDir;
    
    @Test
    void testFromFile_OverridesInferredMetadata() throws Exception {
        Path file = tempDir.resolve("temp_1700000000000.bin");
        Files.write(file, new byte[] {1, 2, 3, 4});
        
        OutgoingMedia media = OutgoingMedia.fromFile(file)
            .withMimeType("video/mp4")
            .withFilename("temp_1700000000000.mp4");
        
        assertEquals(4, media.size());
        assertEquals("video/mp4", media.mimeType());
        assertEquals("temp_1700000000000.mp4", media.filename());
    }
    
    @Test
    void testFromFile_MissingFileThrows() {
        assertThrows(java.io.IOException.class, () -> OutgoingMedia.fromFile(tempDir.resolve("absent.jpg")));
    }
    
    @Test
    void testSendOptions_NullCaptionBecomesEmpty() {
        SendOptions options = SendOptions.inline(null, true);
        
        assertEquals("", options.caption());
        assertTrue(options.sendAudioAsVoice());
        assertFalse(options.sendMediaAsDocument());
    }
}
