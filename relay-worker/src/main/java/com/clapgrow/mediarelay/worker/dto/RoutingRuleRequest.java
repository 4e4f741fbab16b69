package com.clapgrow.mediarelay.worker.dto;

import com.clapgrow.mediarelay.worker.model.RoutingRule;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RoutingRuleRequest {
    @NotBlank(message = "Source group is required")
    private String source;

    @NotEmpty(message = "At least one target group is required")
    private List<String> targets = new ArrayList<>();

    // Optional type filter (engine wire names), empty relays every media type
    private List<String> types = new ArrayList<>();

    public RoutingRule toRule() {
        return new RoutingRule(source == null ? null : source.trim(), targets, types);
    }
}
