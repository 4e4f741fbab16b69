package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.exception.InvalidRuleIndexException;
import com.clapgrow.mediarelay.worker.exception.RoutingConfigPersistenceException;
import com.clapgrow.mediarelay.worker.model.RoutingRule;
import com.clapgrow.mediarelay.worker.model.RoutingTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the routing table in memory and keeps it in sync with the config file.
 * 
 * Readers get immutable snapshots. Edits are serialized and applied in memory
 * only once the new table has been written.
 */
@Service
@Slf4j
public class RoutingTableService {
    
    private final RoutingConfigStore configStore;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private RoutingTable table;
    
    public RoutingTableService(RoutingConfigStore configStore) {
        this.configStore = configStore;
        try {
            this.table = configStore.load();
        } catch (IOException e) {
            throw new RoutingConfigPersistenceException(
                "Failed to load routing config " + configStore.getConfigFile(), e);
        }
    }
    
    public RoutingTable snapshot() {
        lock.readLock().lock();
        try {
            return table;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public List<RoutingRule> match(String sourceId) {
        return snapshot().match(sourceId);
    }
    
    /**
     * Append a rule and persist the table.
     * 
     * @return Table after the change
     * @throws RoutingConfigPersistenceException if the table could not be saved
     */
    public RoutingTable addRule(RoutingRule rule) {
        lock.writeLock().lock();
        try {
            RoutingTable next = table.append(rule);
            persist(next);
            table = next;
            log.info("Added routing rule {}", rule);
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Remove the rule at {@code index} and persist the table.
     * 
     * @throws InvalidRuleIndexException if index is outside the table
     * @throws RoutingConfigPersistenceException if the table could not be saved
     */
    public RoutingTable removeRule(int index) {
        lock.writeLock().lock();
        try {
            if (index < 0 || index >= table.size()) {
                throw new InvalidRuleIndexException(index);
            }
            RoutingRule removed = table.rules().get(index);
            RoutingTable next = table.remove(index);
            persist(next);
            table = next;
            log.info("Removed routing rule {} at index {}", removed, index);
            return next;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private void persist(RoutingTable next) {
        try {
            configStore.save(next);
        } catch (IOException e) {
            throw new RoutingConfigPersistenceException("Failed to save routing config", e);
        }
    }
}
