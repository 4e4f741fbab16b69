package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.config.RelayProperties;
import com.clapgrow.mediarelay.worker.model.RoutingConfigDocument;
import com.clapgrow.mediarelay.worker.model.RoutingTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes the routing config document ({@code {"rules": [...]}}).
 * 
 * - missing file: empty table, and a default document is written
 * - malformed file: kept aside as {@code <name>.corrupt-<epochMillis>}, then a default is written
 * - save: pretty-printed, written to a temp file and moved over the target
 */
@Component
@Slf4j
public class RoutingConfigStore {
    
    private final ObjectMapper objectMapper;
    private final Path configFile;
    
    @Autowired
    public RoutingConfigStore(ObjectMapper objectMapper, RelayProperties properties) {
        this(objectMapper, Paths.get(properties.getRouting().getConfigFile()));
    }
    
    RoutingConfigStore(ObjectMapper objectMapper, Path configFile) {
        this.objectMapper = objectMapper;
        this.configFile = configFile.toAbsolutePath().normalize();
    }
    
    /**
     * Load the routing table, repairing the file when it is missing or malformed.
     * 
     * @throws IOException if the file exists but cannot be read, or the default cannot be written
     */
    public RoutingTable load() throws IOException {
        if (!Files.exists(configFile)) {
            log.info("Routing config {} not found, writing empty default", configFile);
            save(RoutingTable.empty());
            return RoutingTable.empty();
        }
        
        byte[] content = Files.readAllBytes(configFile);
        try {
            RoutingConfigDocument document = objectMapper.readValue(content, RoutingConfigDocument.class);
            if (document == null) {
                throw new IOException("Routing config is empty");
            }
            RoutingTable table = document.toTable();
            log.info("Loaded {} routing rules from {}", table.size(), configFile);
            return table;
        } catch (IOException e) {
            Path backup = configFile.resolveSibling(
                configFile.getFileName() + ".corrupt-" + System.currentTimeMillis());
            log.error("Routing config {} is malformed, moving it to {}", configFile, backup, e);
            Files.move(configFile, backup, StandardCopyOption.REPLACE_EXISTING);
            save(RoutingTable.empty());
            return RoutingTable.empty();
        }
    }
    
    /**
     * Persist the whole table, replacing the previous document atomically where the filesystem allows.
     */
    public void save(RoutingTable table) throws IOException {
        Path parent = configFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        
        Path tempFile = configFile.resolveSibling(configFile.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), table.toDocument());
        try {
            Files.move(tempFile, configFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain replace", configFile);
            Files.move(tempFile, configFile, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Saved {} routing rules to {}", table.size(), configFile);
    }
    
    public Path getConfigFile() {
        return configFile;
    }
}
