package com.clapgrow.mediarelay.worker.model;

import com.clapgrow.mediarelay.common.engine.MediaKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoutingRuleTest {

    @Test
    void testTargets_DedupedTrimmedAndOrdered() {
        RoutingRule rule = new RoutingRule("A@g.us", Arrays.asList(" C@g.us", "B@g.us", "C@g.us", null, ""), null);

        assertEquals(List.of("C@g.us", "B@g.us"), rule.targets());
        assertTrue(rule.types().isEmpty());
    }

    @Test
    void testAccepts_EmptyTypesAcceptsEverything() {
        RoutingRule rule = RoutingRule.of("A@g.us", List.of("B@g.us"));

        assertTrue(rule.accepts(MediaKind.GIF, MediaKind.GIF));
    }

    @Test
    void testAccepts_MatchesDeclaredOrEffectiveKind() {
        RoutingRule rule = new RoutingRule("A@g.us", List.of("B@g.us"), List.of("video", "document"));

        assertEquals(Set.of(MediaKind.VIDEO, MediaKind.DOCUMENT), rule.mediaKinds());
        assertTrue(rule.accepts(MediaKind.VIDEO, MediaKind.VIDEO));
        assertTrue(rule.accepts(MediaKind.DOCUMENT, MediaKind.IMAGE));
        assertFalse(rule.accepts(MediaKind.IMAGE, MediaKind.IMAGE));
    }

    @Test
    void testJson_OmitsEmptyTypesAndIgnoresUnknownFields() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        String json = mapper.writeValueAsString(RoutingRule.of("A@g.us", List.of("B@g.us")));
        RoutingRule parsed = mapper.readValue(
            "{\"source\": \"A@g.us\", \"targets\": [\"B@g.us\"], \"comment\": \"family to work\"}", RoutingRule.class);

        assertFalse(json.contains("types"));
        assertEquals(RoutingRule.of("A@g.us", List.of("B@g.us")), parsed);
    }

    @Test
    void testTable_RemoveOutOfRangeThrows() {
        RoutingTable table = RoutingTable.empty().append(RoutingRule.of("A@g.us", List.of("B@g.us")));

        assertThrows(IndexOutOfBoundsException.class, () -> table.remove(1));
        assertEquals(0, table.remove(0).size());
        assertEquals(1, table.size());
    }
}
