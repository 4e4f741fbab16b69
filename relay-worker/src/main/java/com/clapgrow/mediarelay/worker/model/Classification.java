package com.clapgrow.mediarelay.worker.model;

import com.clapgrow.mediarelay.common.engine.MediaKind;
import com.clapgrow.mediarelay.worker.enums.ClassificationVerdict;

import java.util.List;

/**
 * Classifier output for one inbound message.
 * 
 * @param verdict What to do with the message
 * @param rules Rules that will relay it (empty unless RELAYABLE)
 * @param effectiveKind Declared kind, or IMAGE/VIDEO for a document whose MIME type is visual media
 */
public record Classification(
    ClassificationVerdict verdict,
    List<RoutingRule> rules,
    MediaKind effectiveKind
) {
    
    public Classification {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }
    
    public static Classification discard(ClassificationVerdict verdict, MediaKind effectiveKind) {
        return new Classification(verdict, List.of(), effectiveKind);
    }
    
    public static Classification relayable(List<RoutingRule> rules, MediaKind effectiveKind) {
        return new Classification(ClassificationVerdict.RELAYABLE, rules, effectiveKind);
    }
    
    public boolean isRelayable() {
        return verdict == ClassificationVerdict.RELAYABLE;
    }
}
