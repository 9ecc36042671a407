package com.brokerage.risk.controller;

import com.brokerage.risk.model.AcknowledgeRequest;
import com.brokerage.risk.model.Alert;
import com.brokerage.risk.model.AlertQuery;
import com.brokerage.risk.model.AlertSummary;
import com.brokerage.risk.model.AlertType;
import com.brokerage.risk.model.EntityType;
import com.brokerage.risk.model.RiskLevel;
import com.brokerage.risk.service.AlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Alert log, acknowledgement and summary")
public class AlertController {

    private final AlertService alertService;

    public AlertController(AlertService alertService) {
        this.alertService = alertService;
    }

    @GetMapping
    @Operation(summary = "List alerts",
               description = "Newest first. All filters are optional; since is epoch milliseconds (detection time).")
    public ResponseEntity<List<Alert>> getAlerts(
            @RequestParam(required = false) Boolean acknowledged,
            @RequestParam(required = false) RiskLevel severity,
            @RequestParam(required = false) EntityType entityType,
            @RequestParam(required = false) AlertType alertType,
            @RequestParam(required = false) Long since,
            @RequestParam(defaultValue = "100") int limit) {
        AlertQuery query = AlertQuery.builder()
                .acknowledged(acknowledged)
                .severity(severity)
                .entityType(entityType)
                .alertType(alertType)
                .since(since)
                .limit(Math.max(0, limit))
                .build();
        return ResponseEntity.ok(alertService.query(query));
    }

    @GetMapping("/summary")
    @Operation(summary = "Alert summary",
               description = "Total and unacknowledged counts, unacknowledged broken down by severity and type")
    public ResponseEntity<AlertSummary> getSummary() {
        return ResponseEntity.ok(alertService.summary());
    }

    @GetMapping("/{alertId}")
    @Operation(summary = "Get an alert")
    public ResponseEntity<?> getAlert(@PathVariable String alertId) {
        return alertService.findById(alertId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{alertId}/acknowledge")
    @Operation(summary = "Acknowledge an alert",
               description = "Optional body: {\"acknowledgedBy\": \"name\"}. Re-acknowledging keeps the first acknowledgement.")
    public ResponseEntity<?> acknowledge(@PathVariable String alertId,
                                         @RequestBody(required = false) Map<String, String> body) {
        String acknowledgedBy = body != null ? body.getOrDefault("acknowledgedBy", "ops") : "ops";
        return alertService.acknowledge(alertId, acknowledgedBy)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/acknowledge")
    @Operation(summary = "Acknowledge several alerts",
               description = "Unknown ids are ignored. acknowledgedBy defaults to ops.")
    public ResponseEntity<?> acknowledgeAll(@RequestBody AcknowledgeRequest request) {
        List<String> alertIds = request.alertIds();
        if (alertIds == null || alertIds.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "alertIds is required and must not be empty"));
        }

        List<Alert> acknowledged = alertService.acknowledgeAll(alertIds, request.acknowledgedByOrDefault());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("acknowledgedCount", acknowledged.size());
        response.put("requestedCount", alertIds.size());
        return ResponseEntity.ok(response);
    }
}
