package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.common.engine.MediaKind;
import com.clapgrow.mediarelay.worker.enums.ClassificationVerdict;
import com.clapgrow.mediarelay.worker.model.Classification;
import com.clapgrow.mediarelay.worker.model.InboundMessage;
import com.clapgrow.mediarelay.worker.model.RoutingRule;
import com.clapgrow.mediarelay.worker.model.RoutingTable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether an inbound message is relayed and by which rules.
 * 
 * Media means image, video, GIF, or a document whose MIME type is image/* or video/*.
 * Pure function of the message and the routing table it is given.
 */
@Component
public class MessageClassifier {
    
    public Classification classify(InboundMessage message, RoutingTable table) {
        MediaKind declared = message.declaredType();
        if (!message.group()) {
            return Classification.discard(ClassificationVerdict.NOT_GROUP, declared);
        }
        
        List<RoutingRule> matched = table.match(message.chatId());
        if (matched.isEmpty()) {
            return Classification.discard(ClassificationVerdict.NO_MATCHING_RULE, declared);
        }
        
        MediaKind effective = effectiveKind(declared, message.mimeType());
        if (!effective.isVisualMedia()) {
            return Classification.discard(ClassificationVerdict.NOT_MEDIA, effective);
        }
        
        List<RoutingRule> accepting = matched.stream()
            .filter(rule -> rule.accepts(declared, effective))
            .toList();
        if (accepting.isEmpty()) {
            return Classification.discard(ClassificationVerdict.FILTERED_BY_TYPE, effective);
        }
        return Classification.relayable(accepting, effective);
    }
    
    /**
     * Declared kind, promoted to IMAGE or VIDEO for a document carrying visual media.
     */
    static MediaKind effectiveKind(MediaKind declared, String mimeType) {
        if (declared != MediaKind.DOCUMENT || mimeType == null) {
            return declared;
        }
        String mime = mimeType.toLowerCase(Locale.ROOT);
        if (mime.startsWith("image/")) {
            return MediaKind.IMAGE;
        }
        if (mime.startsWith("video/")) {
            return MediaKind.VIDEO;
        }
        return declared;
    }
}
