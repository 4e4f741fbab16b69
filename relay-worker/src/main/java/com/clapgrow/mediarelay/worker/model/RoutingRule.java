package com.clapgrow.mediarelay.worker.model;

import com.clapgrow.mediarelay.common.engine.MediaKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One routing rule: media seen in {@code source} goes to every chat in {@code targets}.
 * 
 * Targets behave as an ordered set (duplicates dropped, first occurrence wins).
 * {@code types} holds engine wire names ("image", "video", "document", ...) as
 * stored in the config document; empty means no type filter.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingRule(
    String source,
    List<String> targets,
    List<String> types
) {
    
    public RoutingRule {
        targets = distinct(targets);
        types = distinct(types);
    }
    
    public static RoutingRule of(String source, List<String> targets) {
        return new RoutingRule(source, targets, List.of());
    }
    
    /**
     * Type filter as media kinds; empty when the rule accepts every relayable kind.
     */
    @JsonIgnore
    public Set<MediaKind> mediaKinds() {
        Set<MediaKind> kinds = EnumSet.noneOf(MediaKind.class);
        for (String type : types) {
            kinds.add(MediaKind.fromWireName(type));
        }
        return kinds;
    }
    
    /**
     * Whether this rule relays a message of the given kinds.
     * 
     * @param declaredKind Kind the engine declared
     * @param effectiveKind Kind after MIME sniffing (IMAGE/VIDEO for a promoted document)
     */
    public boolean accepts(MediaKind declaredKind, MediaKind effectiveKind) {
        if (types.isEmpty()) {
            return true;
        }
        Set<MediaKind> kinds = mediaKinds();
        return kinds.contains(declaredKind) || kinds.contains(effectiveKind);
    }
    
    private static List<String> distinct(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                seen.add(value.trim());
            }
        }
        return List.copyOf(new ArrayList<>(seen));
    }
    
    @Override
    public String toString() {
        return "RoutingRule[" + Objects.toString(source) + " -> " + targets
            + (types.isEmpty() ? "" : " types=" + types) + "]";
    }
}
