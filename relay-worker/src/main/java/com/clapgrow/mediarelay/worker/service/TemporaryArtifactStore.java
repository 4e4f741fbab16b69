package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.config.RelayProperties;
import com.clapgrow.mediarelay.worker.model.TemporaryArtifact;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes downloaded media to disk for native re-upload and removes it again.
 * 
 * Every artifact is deleted once its grace period after creation has passed,
 * whatever happened to the send. Files still outstanding at shutdown are
 * deleted immediately.
 */
@Service
@Slf4j
public class TemporaryArtifactStore {
    
    private final Path storageRoot;
    private final RelayProperties properties;
    private final TaskScheduler relayTaskScheduler;
    private final MediaExtensionResolver extensionResolver;
    
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Path, ScheduledFuture<?>> pendingCleanups = new ConcurrentHashMap<>();
    
    public TemporaryArtifactStore(RelayProperties properties,
                                  TaskScheduler relayTaskScheduler,
                                  MediaExtensionResolver extensionResolver) {
        this.properties = properties;
        this.relayTaskScheduler = relayTaskScheduler;
        this.extensionResolver = extensionResolver;
        this.storageRoot = Paths.get(properties.getDelivery().getPublicDir()).toAbsolutePath().normalize();
    }
    
    /**
     * Write a payload under the storage root, creating the root if needed.
     * 
     * @param data Payload bytes
     * @param mimeType Observed MIME type, kept as-is on the artifact and used for the extension
     * @return Artifact describing the written file (size as found on disk)
     * @throws IOException if the file cannot be written
     */
    public TemporaryArtifact write(byte[] data, String mimeType) throws IOException {
        Files.createDirectories(storageRoot);
        
        String extension = extensionResolver.extensionFor(mimeType);
        String filename = String.format("temp_%d_%d.%s",
            System.currentTimeMillis(), sequence.incrementAndGet(), extension);
        Path filePath = storageRoot.resolve(filename);
        
        Files.write(filePath, data);
        long size = Files.size(filePath);
        log.debug("Saved {} ({} bytes). Mime: {}", filename, size, mimeType);
        
        String observedMime = mimeType == null || mimeType.isBlank()
            ? MediaExtensionResolver.DEFAULT_MIME_TYPE
            : mimeType;
        return new TemporaryArtifact(filePath, observedMime, size, Instant.now());
    }
    
    /**
     * Schedule deletion at creation time plus the configured grace period.
     */
    public void scheduleCleanup(TemporaryArtifact artifact) {
        Instant deleteAt = artifact.createdAt().plus(properties.getDelivery().getCleanupGrace());
        Path filePath = artifact.filePath();
        ScheduledFuture<?> future = relayTaskScheduler.schedule(() -> delete(filePath), deleteAt);
        pendingCleanups.put(filePath, future);
    }
    
    /**
     * Delete a temporary file. Safe to call more than once.
     */
    public void delete(Path filePath) {
        pendingCleanups.remove(filePath);
        try {
            if (Files.deleteIfExists(filePath)) {
                log.debug("Deleted temporary file {}", filePath.getFileName());
            }
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", filePath, e.getMessage());
        }
    }
    
    public int pendingCleanupCount() {
        return pendingCleanups.size();
    }
    
    public Path getStorageRoot() {
        return storageRoot;
    }
    
    @PreDestroy
    public void deleteOutstanding() {
        if (pendingCleanups.isEmpty()) {
            return;
        }
        log.info("Deleting {} outstanding temporary files", pendingCleanups.size());
        for (Map.Entry<Path, ScheduledFuture<?>> entry : Map.copyOf(pendingCleanups).entrySet()) {
            entry.getValue().cancel(false);
            delete(entry.getKey());
        }
    }
}
