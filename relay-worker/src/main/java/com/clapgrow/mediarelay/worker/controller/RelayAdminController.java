package com.clapgrow.mediarelay.worker.controller;

import com.clapgrow.mediarelay.worker.dto.RoutingRuleRequest;
import com.clapgrow.mediarelay.worker.dto.SessionStatusResponse;
import com.clapgrow.mediarelay.worker.exception.BadRequestException;
import com.clapgrow.mediarelay.worker.model.GroupRecord;
import com.clapgrow.mediarelay.worker.model.RefreshResult;
import com.clapgrow.mediarelay.worker.model.RoutingConfigDocument;
import com.clapgrow.mediarelay.worker.model.RoutingRule;
import com.clapgrow.mediarelay.worker.model.RoutingTable;
import com.clapgrow.mediarelay.worker.service.GroupDirectoryService;
import com.clapgrow.mediarelay.worker.service.RoutingTableService;
import com.clapgrow.mediarelay.worker.service.SessionContext;
import com.clapgrow.mediarelay.worker.service.SessionLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dashboard API: routing rules, group directory and session status.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Relay Admin", description = "Routing rules, group directory and session control")
public class RelayAdminController {

    private final RoutingTableService routingTableService;
    private final GroupDirectoryService groupDirectoryService;
    private final SessionContext sessionContext;
    private final SessionLifecycleService sessionLifecycleService;

    @GetMapping("/groups")
    @Operation(summary = "List known groups")
    public List<GroupRecord> getGroups() {
        return groupDirectoryService.currentGroups();
    }

    @PostMapping("/groups/refresh")
    @Operation(summary = "Refresh the group directory now")
    public RefreshResult refreshGroups() {
        return groupDirectoryService.refreshNow();
    }

    @GetMapping("/config")
    @Operation(summary = "Get routing rules")
    public RoutingConfigDocument getConfig() {
        return routingTableService.snapshot().toDocument();
    }

    @PostMapping("/config/rules")
    @Operation(summary = "Add a routing rule")
    public ResponseEntity<Map<String, Object>> addRule(@Valid @RequestBody RoutingRuleRequest request) {
        RoutingRule rule = request.toRule();
        if (rule.targets().isEmpty()) {
            throw new BadRequestException("At least one target group is required");
        }
        if (rule.targets().contains(rule.source())) {
            throw new BadRequestException("Source group cannot be one of its own targets");
        }

        RoutingTable table = routingTableService.addRule(rule);
        return ResponseEntity.ok(success(table));
    }

    @DeleteMapping("/config/rules/{index}")
    @Operation(summary = "Delete a routing rule by position")
    public ResponseEntity<Map<String, Object>> deleteRule(@PathVariable int index) {
        RoutingTable table = routingTableService.removeRule(index);
        return ResponseEntity.ok(success(table));
    }

    @GetMapping("/status")
    @Operation(summary = "Get session status")
    public SessionStatusResponse getStatus() {
        SessionContext.Snapshot snapshot = sessionContext.snapshot();
        return new SessionStatusResponse(
            snapshot.state(),
            snapshot.label(),
            snapshot.reconnecting(),
            snapshot.groups().size());
    }

    @PostMapping("/session/restart")
    @Operation(summary = "Restart the engine session", description = "Use after an authentication failure")
    public ResponseEntity<Map<String, Object>> restartSession() {
        sessionLifecycleService.restart();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("message", "Session restart scheduled");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    private Map<String, Object> success(RoutingTable table) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("config", table.toDocument());
        return response;
    }
}
