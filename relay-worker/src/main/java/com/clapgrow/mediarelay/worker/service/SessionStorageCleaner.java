package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.config.RelayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Deletes the engine's persisted credentials and cache so the next start is cold.
 * 
 * Every directory is attempted even if an earlier one fails; a missing
 * directory counts as already clean.
 */
@Component
@Slf4j
public class SessionStorageCleaner {
    
    private final List<Path> directories;
    
    @Autowired
    public SessionStorageCleaner(RelayProperties properties) {
        this(List.of(
            Paths.get(properties.getSession().getAuthDir()),
            Paths.get(properties.getSession().getCacheDir())
        ));
    }
    
    SessionStorageCleaner(List<Path> directories) {
        this.directories = List.copyOf(directories);
    }
    
    /**
     * Recursively delete the auth and cache directories.
     * 
     * @return Directories that existed and were deleted
     * @throws IOException if any directory could not be deleted (after all were attempted)
     */
    public List<Path> wipe() throws IOException {
        List<Path> deleted = new ArrayList<>();
        IOException failure = null;
        for (Path directory : directories) {
            try {
                if (FileSystemUtils.deleteRecursively(directory)) {
                    log.info("Deleted session data {}", directory.toAbsolutePath());
                    deleted.add(directory);
                } else {
                    log.debug("Session data {} not present, nothing to delete", directory.toAbsolutePath());
                }
            } catch (IOException e) {
                log.error("Failed to delete session data {}", directory.toAbsolutePath(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return deleted;
    }
    
    public List<Path> getDirectories() {
        return directories;
    }
}
