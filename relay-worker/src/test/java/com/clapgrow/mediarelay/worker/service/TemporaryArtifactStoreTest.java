package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.config.RelayProperties;
import com.clapgrow.mediarelay.worker.model.TemporaryArtifact;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TemporaryArtifactStoreTest {

    @TempDir
    Path workDir;

    private ThreadPoolTaskScheduler scheduler;
    private Path publicDir;
    private TemporaryArtifactStore store;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();

        publicDir = workDir.resolve("public");
        RelayProperties properties = new RelayProperties();
        properties.getDelivery().setPublicDir(publicDir.toString());
        properties.getDelivery().setCleanupGrace(Duration.ofMillis(200));

        store = new TemporaryArtifactStore(properties, scheduler, new MediaExtensionResolver());
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void testWrite_CreatesStorageRootAndNamesFileByMime() throws Exception {
        TemporaryArtifact artifact = store.write(new byte[] {1, 2, 3}, "video/mp4");

        assertTrue(Files.isDirectory(publicDir));
        assertEquals(publicDir.toAbsolutePath().normalize(), artifact.filePath().getParent());
        assertTrue(artifact.filename().matches("temp_\\d+_\\d+\\.mp4"));
        assertEquals(3, artifact.sizeBytes());
        assertEquals("video/mp4", artifact.mimeType());
    }

    @Test
    void testWrite_KeepsObservedMimeAndDefaultsWhenAbsent() throws Exception {
        TemporaryArtifact withParams = store.write(new byte[] {1}, "Video/MP4; codecs=avc1");
        TemporaryArtifact absent = store.write(new byte[] {2}, null);

        assertEquals("Video/MP4; codecs=avc1", withParams.mimeType());
        assertTrue(withParams.filename().endsWith(".mp4"));
        assertEquals("application/octet-stream", absent.mimeType());
        assertTrue(absent.filename().endsWith(".octet-stream"));
    }

    @Test
    void testWrite_SameMillisecond_ProducesDistinctFiles() throws Exception {
        TemporaryArtifact first = store.write(new byte[] {1}, "image/jpeg");
        TemporaryArtifact second = store.write(new byte[] {2}, "image/jpeg");

        assertNotEquals(first.filePath(), second.filePath());
    }

    @Test
    void testScheduleCleanup_FileGoneAfterGracePeriod() throws Exception {
        TemporaryArtifact artifact = store.write(new byte[] {1, 2, 3}, "image/png");

        store.scheduleCleanup(artifact);
        assertTrue(Files.exists(artifact.filePath()));

        long deadline = System.currentTimeMillis() + 5000;
        while (Files.exists(artifact.filePath()) && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertFalse(Files.exists(artifact.filePath()));
        assertEquals(0, store.pendingCleanupCount());
    }

    @Test
    void testDelete_IsIdempotent() throws Exception {
        TemporaryArtifact artifact = store.write(new byte[] {1}, null);

        store.delete(artifact.filePath());
        store.delete(artifact.filePath());

        assertFalse(Files.exists(artifact.filePath()));
        assertTrue(artifact.filename().endsWith(".octet-stream"));
    }

    @Test
    void testDeleteOutstanding_RemovesPendingFiles() throws Exception {
        RelayProperties properties = new RelayProperties();
        properties.getDelivery().setPublicDir(publicDir.toString());
        properties.getDelivery().setCleanupGrace(Duration.ofHours(1));
        TemporaryArtifactStore slowStore = new TemporaryArtifactStore(properties, scheduler, new MediaExtensionResolver());
        TemporaryArtifact artifact = slowStore.write(new byte[] {1}, "image/gif");
        slowStore.scheduleCleanup(artifact);

        slowStore.deleteOutstanding();

        assertFalse(Files.exists(artifact.filePath()));
        assertEquals(0, slowStore.pendingCleanupCount());
    }
}
