package com.clapgrow.mediarelay.worker.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of routing rules, immutable.
 * 
 * Insertion order only matters for display and for delete-by-index.
 */
public record RoutingTable(List<RoutingRule> rules) {
    
    public RoutingTable {
        rules = rules == null ? List.of() : rules.stream()
            .filter(rule -> rule != null)
            .toList();
    }
    
    public static RoutingTable empty() {
        return new RoutingTable(List.of());
    }
    
    /**
     * All rules whose source equals the given chat id; a source may appear in several rules.
     */
    public List<RoutingRule> match(String sourceId) {
        if (sourceId == null) {
            return List.of();
        }
        return rules.stream()
            .filter(rule -> sourceId.equals(rule.source()))
            .toList();
    }
    
    public RoutingTable append(RoutingRule rule) {
        List<RoutingRule> next = new ArrayList<>(rules);
        next.add(rule);
        return new RoutingTable(next);
    }
    
    /**
     * Table without the rule at {@code index}.
     * 
     * @throws IndexOutOfBoundsException if index is outside the table
     */
    public RoutingTable remove(int index) {
        if (index < 0 || index >= rules.size()) {
            throw new IndexOutOfBoundsException("Invalid index: " + index);
        }
        List<RoutingRule> next = new ArrayList<>(rules);
        next.remove(index);
        return new RoutingTable(next);
    }
    
    public int size() {
        return rules.size();
    }
    
    public RoutingConfigDocument toDocument() {
        return new RoutingConfigDocument(new ArrayList<>(rules));
    }
}
