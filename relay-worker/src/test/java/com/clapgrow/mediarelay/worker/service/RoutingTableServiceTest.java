package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.exception.InvalidRuleIndexException;
import com.clapgrow.mediarelay.worker.model.RoutingRule;
import com.clapgrow.mediarelay.worker.model.RoutingTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class RoutingTableServiceTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Path configFile;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        configFile = tempDir.resolve("config.json");
    }

    @Test
    void testLoad_MissingFile_StartsEmptyAndWritesDefault() throws IOException {
        RoutingTableService service = new RoutingTableService(new RoutingConfigStore(objectMapper, configFile));

        assertEquals(0, service.snapshot().size());
        assertTrue(Files.exists(configFile));
        assertEquals(0, objectMapper.readTree(configFile.toFile()).get("rules").size());
    }

    @Test
    void testLoad_MalformedFile_KeepsBackupAndStartsEmpty() throws IOException {
        Files.writeString(configFile, "{ this is not json");

        RoutingTableService service = new RoutingTableService(new RoutingConfigStore(objectMapper, configFile));

        assertEquals(0, service.snapshot().size());
        try (Stream<Path> files = Files.list(tempDir)) {
            List<Path> backups = files
                .filter(path -> path.getFileName().toString().startsWith("config.json.corrupt-"))
                .toList();
            assertEquals(1, backups.size());
            assertEquals("{ this is not json", Files.readString(backups.get(0)));
        }
        assertEquals(0, objectMapper.readTree(configFile.toFile()).get("rules").size());
    }

    @Test
    void testLoad_ExistingFile_ReadsRules() throws IOException {
        Files.writeString(configFile, """
            {
              "rules": [
                { "source": "A@g.us", "targets": ["B@g.us", "C@g.us"] },
                { "source": "D@g.us", "targets": ["E@g.us"], "types": ["video"] }
              ]
            }
            """);

        RoutingTableService service = new RoutingTableService(new RoutingConfigStore(objectMapper, configFile));

        assertEquals(2, service.snapshot().size());
        assertEquals(List.of("B@g.us", "C@g.us"), service.match("A@g.us").get(0).targets());
        assertEquals(List.of("video"), service.match("D@g.us").get(0).types());
    }

    @Test
    void testMatch_SourceInSeveralRules_ReturnsAllOfThem() {
        RoutingTableService service = new RoutingTableService(new RoutingConfigStore(objectMapper, configFile));
        service.addRule(RoutingRule.of("A@g.us", List.of("B@g.us")));
        service.addRule(RoutingRule.of("X@g.us", List.of("Y@g.us")));
        service.addRule(RoutingRule.of("A@g.us", List.of("C@g.us")));

        List<RoutingRule> matched = service.match("A@g.us");

        assertEquals(2, matched.size());
        assertEquals(List.of("B@g.us"), matched.get(0).targets());
        assertEquals(List.of("C@g.us"), matched.get(1).targets());
        assertTrue(service.match("Z@g.us").isEmpty());
    }

    @Test
    void testAddThenRemove_RestoresOriginalTable() throws IOException {
        RoutingTableService service = new RoutingTableService(new RoutingConfigStore(objectMapper, configFile));
        service.addRule(RoutingRule.of("A@g.us", List.of("B@g.us")));
        RoutingTable before = service.snapshot();

        service.addRule(RoutingRule.of("C@g.us", List.of("D@g.us")));
        RoutingTable after = service.removeRule(1);

        assertEquals(before, after);
        RoutingTableService reloaded = new RoutingTableService(new RoutingConfigStore(objectMapper, configFile));
        assertEquals(before, reloaded.snapshot());
    }

    @Test
    void testRemoveRule_OutOfRange_ThrowsAndKeepsTable() {
        RoutingTableService service = new RoutingTableService(new RoutingConfigStore(objectMapper, configFile));
        service.addRule(RoutingRule.of("A@g.us", List.of("B@g.us")));

        InvalidRuleIndexException error = assertThrows(InvalidRuleIndexException.class,
            () -> service.removeRule(5));

        assertEquals(5, error.getIndex());
        assertThrows(InvalidRuleIndexException.class, () -> service.removeRule(-1));
        assertEquals(1, service.snapshot().size());
    }

    @Test
    void testAddRule_PersistsPrettyPrintedDocument() throws IOException {
        RoutingTableService service = new RoutingTableService(new RoutingConfigStore(objectMapper, configFile));

        service.addRule(new RoutingRule("A@g.us", List.of("B@g.us", "B@g.us", "C@g.us"), List.of()));

        String content = Files.readString(configFile);
        assertTrue(content.contains("\n"));
        assertEquals(2, objectMapper.readTree(content).get("rules").get(0).get("targets").size());
        assertFalse(Files.exists(tempDir.resolve("config.json.tmp")));
    }
}
