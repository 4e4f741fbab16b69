package com.clapgrow.mediarelay.worker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted and API shape of the routing table: {@code {"rules": [...]}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingConfigDocument {
    private List<RoutingRule> rules = new ArrayList<>();
    
    public RoutingTable toTable() {
        return new RoutingTable(rules);
    }
}
